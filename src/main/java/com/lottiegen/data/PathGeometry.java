package com.lottiegen.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable ordered list of {@link BezierSegment}s forming one path shape.
 * Two geometries are equal iff their segment lists are equal element by element.
 *
 * <p>Paths can only be interpolated between geometries with the same segment
 * count, which is what the segment reconciler in the optimizer works around.</p>
 */
public final class PathGeometry {

    public final List<BezierSegment> beziers;

    public PathGeometry(List<BezierSegment> beziers) {
        this.beziers = Collections.unmodifiableList(new ArrayList<>(beziers));
    }

    public PathGeometry(BezierSegment... beziers) {
        this(Arrays.asList(beziers));
    }

    public int segmentCount() { return beziers.size(); }

    /** Polyline through the given points, one straight segment per consecutive pair. */
    public static PathGeometry polyline(Vector2... points) {
        List<BezierSegment> segments = new ArrayList<>();
        for (int i = 1; i < points.length; i++)
            segments.add(BezierSegment.line(points[i - 1], points[i]));
        return new PathGeometry(segments);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PathGeometry)) return false;
        return beziers.equals(((PathGeometry) o).beziers);
    }

    @Override
    public int hashCode() {
        return beziers.hashCode();
    }

    @Override
    public String toString() {
        return "PathGeometry" + beziers;
    }
}
