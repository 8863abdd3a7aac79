package com.lottiegen.data;

import java.util.Objects;

/**
 * One cubic Bezier segment of a {@link PathGeometry}.
 *
 * <p>{@link #controlPoint0} and {@link #controlPoint3} are the end points;
 * {@link #controlPoint1} and {@link #controlPoint2} are the handles.</p>
 */
public final class BezierSegment {

    public final Vector2 controlPoint0;
    public final Vector2 controlPoint1;
    public final Vector2 controlPoint2;
    public final Vector2 controlPoint3;

    public BezierSegment(Vector2 controlPoint0, Vector2 controlPoint1,
                         Vector2 controlPoint2, Vector2 controlPoint3) {
        this.controlPoint0 = Objects.requireNonNull(controlPoint0, "controlPoint0");
        this.controlPoint1 = Objects.requireNonNull(controlPoint1, "controlPoint1");
        this.controlPoint2 = Objects.requireNonNull(controlPoint2, "controlPoint2");
        this.controlPoint3 = Objects.requireNonNull(controlPoint3, "controlPoint3");
    }

    /** A straight segment with both handles sitting on the end points. */
    public static BezierSegment line(Vector2 from, Vector2 to) {
        return new BezierSegment(from, from, to, to);
    }

    /**
     * True iff the segment draws a straight line from {@link #controlPoint0} to
     * {@link #controlPoint3}: all four points are colinear and neither handle
     * overshoots the end points.
     */
    public boolean isALine() {
        return arePointsColinear(0, controlPoint0, controlPoint1, controlPoint2, controlPoint3)
            && isBetween(controlPoint0, controlPoint1, controlPoint3)
            && isBetween(controlPoint0, controlPoint2, controlPoint3);
    }

    // ── Geometry helpers ──────────────────────────────────────────────────────

    /**
     * True iff every point lies on one straight line. The cross product of each point
     * against the line is rounded (half-even) to {@code decimalPlaces} and must be zero.
     * Coincident points are colinear with anything.
     */
    public static boolean arePointsColinear(int decimalPlaces, Vector2... points) {
        if (points.length <= 2) return true;

        Vector2 origin = points[0];
        Vector2 direction = null;
        for (int i = 1; i < points.length && direction == null; i++) {
            if (!points[i].equals(origin)) direction = points[i].minus(origin);
        }
        if (direction == null) return true; // all coincident

        double scale = Math.pow(10, decimalPlaces);
        for (Vector2 p : points) {
            Vector2 d = p.minus(origin);
            double cross = direction.x * d.y - direction.y * d.x;
            if (Math.rint(cross * scale) != 0) return false;
        }
        return true;
    }

    /** True iff {@code b} lies between {@code a} and {@code c} on both axes. */
    public static boolean isBetween(Vector2 a, Vector2 b, Vector2 c) {
        return isBetween(a.x, b.x, c.x) && isBetween(a.y, b.y, c.y);
    }

    private static boolean isBetween(double a, double b, double c) {
        double deltaAC = Math.abs(a - c);
        return Math.abs(a - b) <= deltaAC && Math.abs(c - b) <= deltaAC;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BezierSegment)) return false;
        BezierSegment s = (BezierSegment) o;
        return controlPoint0.equals(s.controlPoint0)
            && controlPoint1.equals(s.controlPoint1)
            && controlPoint2.equals(s.controlPoint2)
            && controlPoint3.equals(s.controlPoint3);
    }

    @Override
    public int hashCode() {
        return Objects.hash(controlPoint0, controlPoint1, controlPoint2, controlPoint3);
    }

    @Override
    public String toString() {
        return "Bezier[" + controlPoint0 + " " + controlPoint1 + " "
             + controlPoint2 + " " + controlPoint3 + "]";
    }
}
