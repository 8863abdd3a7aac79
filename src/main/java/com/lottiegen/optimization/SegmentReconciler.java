package com.lottiegen.optimization;

import com.lottiegen.data.BezierSegment;
import com.lottiegen.data.PathGeometry;
import com.lottiegen.data.Vector2;
import com.lottiegen.data.Vector3;
import com.lottiegen.keyframe.Animatable;
import com.lottiegen.keyframe.Keyframe;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Makes path timelines interpolable when their keyframes disagree on segment count,
 * for the one case where that is safe to fix.
 *
 * <h3>Fixable case</h3>
 * <p>Exactly two distinct segment counts appear, and every keyframe's geometry is
 * either one straight line, or two straight lines where the second runs back over the
 * first (its end lies on the first line, between that line's end points). Such a
 * retraced pair draws the same thing as its first line alone, so every keyframe is cut
 * down to its first segment.</p>
 *
 * <p>Anything else (curves, three or more segments, a bend, a retrace that overshoots
 * the start) leaves the timeline as it was.</p>
 */
public final class SegmentReconciler {

    private final OptimizerSettings settings;

    public SegmentReconciler(OptimizerSettings settings) {
        this.settings = settings;
    }

    public Animatable<PathGeometry> reconcile(Animatable<PathGeometry> animatable) {
        Set<Integer> segmentCounts = new HashSet<>();
        for (Keyframe<PathGeometry> kf : animatable.keyframes)
            segmentCounts.add(kf.value.segmentCount());

        // Uniform already, or too irregular to repair.
        if (segmentCounts.size() != 2) return animatable;

        for (Keyframe<PathGeometry> kf : animatable.keyframes) {
            if (!isCollapsible(kf.value)) return animatable;
        }

        List<Keyframe<PathGeometry>> collapsed = new ArrayList<>(animatable.keyframes.size());
        for (Keyframe<PathGeometry> kf : animatable.keyframes)
            collapsed.add(firstSegmentOnly(kf));

        if (settings.verbose) {
            System.out.printf("[SegmentReconciler] Collapsed retraced lines in %d keyframe(s), segment counts were %s%n",
                    collapsed.size(), segmentCounts);
        }
        return new Animatable<>(collapsed.get(0).value, collapsed, animatable.propertyIndex);
    }

    // ── Classification ────────────────────────────────────────────────────────

    private boolean isCollapsible(PathGeometry geometry) {
        List<BezierSegment> segments = geometry.beziers;
        for (BezierSegment segment : segments) {
            if (segment == null)
                throw new CanonicalizationException("Path geometry contains a null segment: " + geometry);
            if (!segment.isALine()) return false;
        }

        return switch (segments.size()) {
            case 1 -> true;
            case 2 -> {
                Vector2 a = segments.get(0).controlPoint0; // start of line 0
                Vector2 b = segments.get(0).controlPoint3; // end of line 0
                Vector2 c = segments.get(1).controlPoint3; // end of line 1
                yield BezierSegment.arePointsColinear(settings.colinearityDecimalPlaces, a, b, c)
                   && BezierSegment.isBetween(a, c, b);
            }
            default -> false;
        };
    }

    private static Keyframe<PathGeometry> firstSegmentOnly(Keyframe<PathGeometry> kf) {
        return new Keyframe<>(kf.frame, new PathGeometry(kf.value.beziers.get(0)),
                Vector3.ZERO, Vector3.ZERO, kf.easing);
    }
}
