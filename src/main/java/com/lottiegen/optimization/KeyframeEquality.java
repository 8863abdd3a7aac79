package com.lottiegen.optimization;

import com.lottiegen.keyframe.Animatable;
import com.lottiegen.keyframe.Easing;
import com.lottiegen.keyframe.Keyframe;

import java.util.List;

/**
 * Structural equality and hashing for the timeline types, built bottom-up:
 * easing, then keyframe, then keyframe sequence, then timeline.
 *
 * <p>Timeline equality compares the initial value and the keyframe sequence only;
 * {@link Animatable#propertyIndex} is ignored so that timelines driving different
 * properties can share one canonical result.</p>
 */
public final class KeyframeEquality {

    private KeyframeEquality() {} // utility class

    // ── Easing ────────────────────────────────────────────────────────────────

    public static boolean equal(Easing x, Easing y) {
        if (x == y) return true;
        if (x == null || y == null) return false;
        if (x.getType() != y.getType()) return false;
        return switch (x.getType()) {
            case LINEAR, HOLD -> true;
            case CUBIC_BEZIER -> x.equals(y);
            default           -> throw unknownEasing(x);
        };
    }

    public static int hash(Easing easing) {
        return switch (easing.getType()) {
            case LINEAR, HOLD -> easing.getType().ordinal();
            case CUBIC_BEZIER -> easing.hashCode();
            default           -> throw unknownEasing(easing);
        };
    }

    private static CanonicalizationException unknownEasing(Easing easing) {
        return new CanonicalizationException("Unrecognized easing type: " + easing.getType());
    }

    // ── Keyframe ──────────────────────────────────────────────────────────────

    public static boolean equal(Keyframe<?> x, Keyframe<?> y) {
        if (x == y) return true;
        if (x == null || y == null) return false;
        return Double.compare(x.frame, y.frame) == 0
            && x.value.equals(y.value)
            && x.spatialControlPoint1.equals(y.spatialControlPoint1)
            && x.spatialControlPoint2.equals(y.spatialControlPoint2)
            && equal(x.easing, y.easing);
    }

    public static int hash(Keyframe<?> keyframe) {
        int h = Double.hashCode(keyframe.frame);
        h = 31 * h + keyframe.value.hashCode();
        h = 31 * h + keyframe.spatialControlPoint1.hashCode();
        h = 31 * h + keyframe.spatialControlPoint2.hashCode();
        return 31 * h + hash(keyframe.easing);
    }

    // ── Keyframe sequence ─────────────────────────────────────────────────────

    /** Pairwise, order-sensitive. */
    public static boolean equal(List<? extends Keyframe<?>> x, List<? extends Keyframe<?>> y) {
        if (x == y) return true;
        if (x == null || y == null) return false;
        if (x.size() != y.size()) return false;
        for (int i = 0; i < x.size(); i++) {
            if (!equal(x.get(i), y.get(i))) return false;
        }
        return true;
    }

    public static int hash(List<? extends Keyframe<?>> keyframes, OptimizerSettings.HashMode mode) {
        int h = 0;
        if (mode == OptimizerSettings.HashMode.LEGACY_XOR) {
            for (Keyframe<?> kf : keyframes) h ^= hash(kf);
        } else {
            h = 1;
            for (Keyframe<?> kf : keyframes) h = 31 * h + hash(kf);
        }
        return h;
    }

    // ── Timeline ──────────────────────────────────────────────────────────────

    public static boolean equal(Animatable<?> x, Animatable<?> y) {
        if (x == y) return true;
        if (x == null || y == null) return false;
        return x.initialValue.equals(y.initialValue) && equal(x.keyframes, y.keyframes);
    }

    public static int hash(Animatable<?> animatable, OptimizerSettings.HashMode mode) {
        return 31 * animatable.initialValue.hashCode() + hash(animatable.keyframes, mode);
    }
}
