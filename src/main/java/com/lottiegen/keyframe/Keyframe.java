package com.lottiegen.keyframe;

import com.lottiegen.data.Vector3;

import java.util.Objects;

/**
 * The value a property reaches at {@link #frame}, together with the spatial tangent
 * handles used for 2D motion paths and the easing of the ramp that ends here.
 *
 * <p>Immutable. Equality covers all five fields.</p>
 *
 * @param <T> animated value type; must have value equality
 */
public final class Keyframe<T> {

    public final double  frame;
    public final T       value;
    public final Vector3 spatialControlPoint1;
    public final Vector3 spatialControlPoint2;
    public final Easing  easing;

    public Keyframe(double frame, T value,
                    Vector3 spatialControlPoint1, Vector3 spatialControlPoint2,
                    Easing easing) {
        this.frame                = frame;
        this.value                = Objects.requireNonNull(value, "value");
        this.spatialControlPoint1 = Objects.requireNonNull(spatialControlPoint1, "spatialControlPoint1");
        this.spatialControlPoint2 = Objects.requireNonNull(spatialControlPoint2, "spatialControlPoint2");
        this.easing               = Objects.requireNonNull(easing, "easing");
    }

    /** Keyframe with zero spatial tangents. */
    public Keyframe(double frame, T value, Easing easing) {
        this(frame, value, Vector3.ZERO, Vector3.ZERO, easing);
    }

    /** Copy of this keyframe with a different easing. */
    public Keyframe<T> withEasing(Easing newEasing) {
        return new Keyframe<>(frame, value, spatialControlPoint1, spatialControlPoint2, newEasing);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Keyframe)) return false;
        Keyframe<?> k = (Keyframe<?>) o;
        return Double.compare(frame, k.frame) == 0
            && value.equals(k.value)
            && spatialControlPoint1.equals(k.spatialControlPoint1)
            && spatialControlPoint2.equals(k.spatialControlPoint2)
            && easing.equals(k.easing);
    }

    @Override
    public int hashCode() {
        return Objects.hash(frame, value, spatialControlPoint1, spatialControlPoint2, easing);
    }

    @Override
    public String toString() {
        return "Keyframe(" + frame + ", " + value + ", " + easing + ")";
    }
}
