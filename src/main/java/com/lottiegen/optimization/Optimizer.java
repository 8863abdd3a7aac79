package com.lottiegen.optimization;

import com.lottiegen.data.Color;
import com.lottiegen.data.PathGeometry;
import com.lottiegen.keyframe.Animatable;
import com.lottiegen.keyframe.Keyframe;

import java.util.Iterator;

/**
 * Creates and caches optimized versions of animation timelines.
 *
 * <p>An optimized timeline shows exactly the same values as its input but may have
 * fewer keyframes. Results are canonical per instance: structurally equal inputs of
 * the same value type return the identical {@link Animatable}, which lets the object
 * graph stage share one animation between all properties that use it.</p>
 *
 * <h3>Lifetime</h3>
 * <p>Create one optimizer per code generation run. Caches only grow. Not thread-safe;
 * the caches are mutated on every miss.</p>
 */
public final class Optimizer {

    private final OptimizerSettings settings;
    private final SegmentReconciler reconciler;

    private final AnimatableCache<Color>        colors;
    private final AnimatableCache<Double>       scalars;
    private final AnimatableCache<PathGeometry> pathGeometries;

    public Optimizer() {
        this(new OptimizerSettings());
    }

    public Optimizer(OptimizerSettings settings) {
        this.settings   = settings;
        this.reconciler = new SegmentReconciler(settings);

        this.colors         = new AnimatableCache<>("Color",  settings.hashMode, v -> v);
        this.scalars        = new AnimatableCache<>("Scalar", settings.hashMode, v -> v);
        this.pathGeometries = new AnimatableCache<>("PathGeometry", settings.hashMode,
                v -> settings.reconcileSegmentCounts ? reconciler.reconcile(v) : v);
    }

    // ── Canonical timelines ───────────────────────────────────────────────────

    public Animatable<Color> getOptimizedColor(Animatable<Color> value) {
        return colors.getOptimized(value);
    }

    public Animatable<Double> getOptimizedScalar(Animatable<Double> value) {
        return scalars.getOptimized(value);
    }

    /**
     * Like the other overloads, and additionally collapses retraced two-segment lines
     * when they are the only thing stopping the path from being interpolated
     * (see {@link SegmentReconciler}).
     */
    public Animatable<PathGeometry> getOptimizedPathGeometry(Animatable<PathGeometry> value) {
        return pathGeometries.getOptimized(value);
    }

    // ── Trimming ──────────────────────────────────────────────────────────────

    /**
     * Returns at most one keyframe with frame less than or equal to {@code startFrame}
     * and at most one with frame greater than or equal to {@code endFrame}.
     * Not cached. See {@link KeyframeTrimmer}.
     */
    public <T> Iterator<Keyframe<T>> getTrimmed(Iterable<Keyframe<T>> keyframes,
                                                double startFrame, double endFrame) {
        return KeyframeTrimmer.trim(keyframes, startFrame, endFrame);
    }

    // ── Diagnostics ───────────────────────────────────────────────────────────

    public OptimizerSettings getSettings() { return settings; }

    /** Prints per-type cache statistics to stdout. */
    public void printStats() {
        printStats(colors);
        printStats(scalars);
        printStats(pathGeometries);
    }

    private static void printStats(AnimatableCache<?> cache) {
        System.out.printf("[Optimizer] %-12s %5d distinct, %5d hits, %5d misses%n",
                cache.name(), cache.size(), cache.hits(), cache.misses());
    }

    AnimatableCache<Color>        colorCache()        { return colors; }
    AnimatableCache<Double>       scalarCache()       { return scalars; }
    AnimatableCache<PathGeometry> pathGeometryCache() { return pathGeometries; }
}
