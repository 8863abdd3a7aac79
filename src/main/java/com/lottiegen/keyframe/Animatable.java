package com.lottiegen.keyframe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Timeline for one animated property: the value in effect before the first keyframe,
 * followed by keyframes in strictly ascending frame order.
 *
 * <h3>Static timelines</h3>
 * <p>A timeline with at most one keyframe, or whose keyframes all hold
 * {@link #initialValue}, never changes. {@link #isAnimated()} is false for those and
 * the optimizer passes them through untouched.</p>
 *
 * <h3>Property index</h3>
 * <p>{@link #propertyIndex} names the property of the owning object this timeline
 * drives. It takes part in {@link #equals} here, but the optimizer's structural
 * comparison ignores it, and timelines synthesized by the optimizer have it cleared.</p>
 *
 * @param <T> animated value type; must have value equality
 */
public final class Animatable<T> {

    public final T                 initialValue;
    public final List<Keyframe<T>> keyframes;
    /** Nullable. */
    public final Integer           propertyIndex;

    public Animatable(T initialValue, List<Keyframe<T>> keyframes, Integer propertyIndex) {
        this.initialValue  = Objects.requireNonNull(initialValue, "initialValue");
        this.keyframes     = Collections.unmodifiableList(new ArrayList<>(keyframes));
        this.propertyIndex = propertyIndex;

        for (int i = 1; i < this.keyframes.size(); i++) {
            if (this.keyframes.get(i).frame <= this.keyframes.get(i - 1).frame)
                throw new IllegalArgumentException(
                        "Keyframe frames must be strictly increasing: " +
                        this.keyframes.get(i - 1).frame + " then " + this.keyframes.get(i).frame);
        }
    }

    /** Non-animated timeline holding {@code value} with a single keyframe at frame 0. */
    public static <T> Animatable<T> ofStatic(T value, Integer propertyIndex) {
        return new Animatable<>(value,
                Collections.singletonList(new Keyframe<>(0, value, LinearEasing.INSTANCE)),
                propertyIndex);
    }

    /**
     * True iff there are at least two keyframes and one of them holds a value
     * other than {@link #initialValue}.
     */
    public boolean isAnimated() {
        if (keyframes.size() <= 1) return false;
        for (Keyframe<T> kf : keyframes)
            if (!kf.value.equals(initialValue)) return true;
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Animatable)) return false;
        Animatable<?> a = (Animatable<?>) o;
        return initialValue.equals(a.initialValue)
            && keyframes.equals(a.keyframes)
            && Objects.equals(propertyIndex, a.propertyIndex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(initialValue, keyframes, propertyIndex);
    }

    @Override
    public String toString() {
        return "Animatable(initial=" + initialValue + ", keyframes=" + keyframes
             + (propertyIndex != null ? ", propertyIndex=" + propertyIndex : "") + ")";
    }
}
