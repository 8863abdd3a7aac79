package com.lottiegen.optimization;

import com.lottiegen.keyframe.Animatable;
import com.lottiegen.keyframe.Keyframe;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Memo table from input timeline to canonical optimized timeline for one value type.
 *
 * <p>Structurally equal inputs (see {@link KeyframeEquality}) always get back the same
 * {@link Animatable} instance, so later stages can detect sharing by identity.
 * Each synthesized result is also registered under its own structure, so feeding a
 * result back in returns it unchanged. Entries are never evicted or replaced.</p>
 */
final class AnimatableCache<T> {

    private final String                                  name;
    private final OptimizerSettings.HashMode              hashMode;
    private final UnaryOperator<Animatable<T>>            postProcess;
    private final Map<AnimatableKey<T>, Animatable<T>>    cache = new HashMap<>();

    private int hits;
    private int misses;

    /**
     * @param postProcess applied to each freshly optimized result before it is cached
     */
    AnimatableCache(String name, OptimizerSettings.HashMode hashMode,
                    UnaryOperator<Animatable<T>> postProcess) {
        this.name        = name;
        this.hashMode    = hashMode;
        this.postProcess = postProcess;
    }

    Animatable<T> getOptimized(Animatable<T> value) {
        if (value.keyframes.isEmpty())
            throw new CanonicalizationException(
                    "Animatable " + name + " has no keyframes (propertyIndex=" + value.propertyIndex + ")");

        AnimatableKey<T> key = new AnimatableKey<>(value, hashMode);
        Animatable<T> result = cache.get(key);
        if (result != null) {
            hits++;
            return result;
        }

        misses++;
        result = postProcess.apply(optimize(value));
        if (result != value) {
            // A synthesized result is a value in its own right: reuse the existing
            // representative of that structure, or make this one the representative.
            AnimatableKey<T> resultKey = new AnimatableKey<>(result, hashMode);
            Animatable<T> existing = cache.get(resultKey);
            if (existing != null) result = existing;
            else cache.put(resultKey, result);
        }
        cache.put(key, result);
        return result;
    }

    private static <T> Animatable<T> optimize(Animatable<T> value) {
        // Not animated, so keyframe elision does not apply.
        if (!value.isAnimated()) return value;

        List<Keyframe<T>> keyframes = KeyframeOptimizer.optimizeToList(value.initialValue, value.keyframes);
        if (KeyframeEquality.equal(keyframes, value.keyframes)) return value; // nothing removed

        // A single keyframe reads as static and would show the initial value instead.
        if (keyframes.size() < 2) return value;

        return new Animatable<>(value.initialValue, keyframes, null);
    }

    // ── Diagnostics ───────────────────────────────────────────────────────────

    String name()  { return name; }
    int    size()  { return cache.size(); }
    int    hits()  { return hits; }
    int    misses(){ return misses; }
}
