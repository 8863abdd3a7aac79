package com.lottiegen.optimization;

/**
 * Mutable settings bean read by an {@link Optimizer}.
 * Defaults reproduce the canonical behavior.
 *
 * <p>{@link #hashMode} is fixed when the optimizer is constructed, since its cache keys
 * are hashed with it; later changes do not affect that optimizer. The other fields are
 * read on each use, but results already cached are never recomputed.</p>
 */
public final class OptimizerSettings {

    /** How keyframe sequence hashes are combined. */
    public enum HashMode {
        /** Position-weighted combiner; permutations hash differently. */
        ORDERED,
        /** XOR of the keyframe hashes, compatible with the legacy optimizer's buckets. */
        LEGACY_XOR
    }

    public HashMode hashMode                 = HashMode.ORDERED;

    // ── Path geometry ─────────────────────────────────────────────────────────
    public boolean  reconcileSegmentCounts   = true;
    public int      colinearityDecimalPlaces = 0;   // cross product rounded to this many places

    // ── Diagnostics ───────────────────────────────────────────────────────────
    public boolean  verbose                  = false;
}
