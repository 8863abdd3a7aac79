package com.lottiegen.optimization;

import com.lottiegen.keyframe.Animatable;

/**
 * Map key that compares timelines with {@link KeyframeEquality} instead of
 * {@link Animatable#equals}. The hash is computed once on construction.
 */
final class AnimatableKey<T> {

    final Animatable<T> animatable;
    private final int   hash;

    AnimatableKey(Animatable<T> animatable, OptimizerSettings.HashMode mode) {
        this.animatable = animatable;
        this.hash       = KeyframeEquality.hash(animatable, mode);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnimatableKey)) return false;
        AnimatableKey<?> other = (AnimatableKey<?>) o;
        return hash == other.hash && KeyframeEquality.equal(animatable, other.animatable);
    }

    @Override
    public int hashCode() {
        return hash;
    }
}
