package com.lottiegen.keyframe;

import com.lottiegen.data.Vector2;

import java.util.Objects;

/**
 * CSS-style cubic Bezier easing. The curve runs from (0,0) to (1,1) with the two
 * given handles; X is linear progress, Y is eased progress.
 */
public final class CubicBezierEasing extends Easing {

    private static final int    SOLVE_ITERATIONS = 32;
    private static final double SOLVE_EPSILON    = 1e-9;

    public final Vector2 controlPoint1;
    public final Vector2 controlPoint2;

    public CubicBezierEasing(Vector2 controlPoint1, Vector2 controlPoint2) {
        this.controlPoint1 = Objects.requireNonNull(controlPoint1, "controlPoint1");
        this.controlPoint2 = Objects.requireNonNull(controlPoint2, "controlPoint2");
    }

    @Override
    public Type getType() { return Type.CUBIC_BEZIER; }

    /**
     * Solves x(s) = t for the curve parameter s by bisection, then returns y(s).
     * X is monotonic for handles inside the unit square, so bisection converges.
     */
    @Override
    public double ease(double t) {
        if (t <= 0) return 0;
        if (t >= 1) return 1;

        double lo = 0, hi = 1, s = t;
        for (int i = 0; i < SOLVE_ITERATIONS; i++) {
            s = (lo + hi) * 0.5;
            double x = bezier(controlPoint1.x, controlPoint2.x, s);
            if (Math.abs(x - t) < SOLVE_EPSILON) break;
            if (x < t) lo = s; else hi = s;
        }
        return bezier(controlPoint1.y, controlPoint2.y, s);
    }

    // One axis of the cubic with fixed end points 0 and 1.
    private static double bezier(double p1, double p2, double s) {
        double u = 1 - s;
        return 3 * u * u * s * p1 + 3 * u * s * s * p2 + s * s * s;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CubicBezierEasing)) return false;
        CubicBezierEasing e = (CubicBezierEasing) o;
        return controlPoint1.equals(e.controlPoint1) && controlPoint2.equals(e.controlPoint2);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Type.CUBIC_BEZIER, controlPoint1, controlPoint2);
    }

    @Override
    public String toString() {
        return "CubicBezier(" + controlPoint1 + ", " + controlPoint2 + ")";
    }
}
