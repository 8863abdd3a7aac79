package com.lottiegen.keyframe;

/**
 * Easing function applied to the ramp that ends at a keyframe.
 *
 * <p>Easings are values: two easings are equal iff they have the same {@link Type}
 * and the same parameters. Subclasses are immutable.</p>
 */
public abstract class Easing {

    public enum Type {
        LINEAR, HOLD, CUBIC_BEZIER
    }

    Easing() {}

    public abstract Type getType();

    /**
     * Maps linear progress {@code t} in [0, 1] to eased progress.
     */
    public abstract double ease(double t);
}
