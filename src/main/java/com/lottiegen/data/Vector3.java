package com.lottiegen.data;

/**
 * Immutable 3D vector. Keyframes carry two of these as spatial tangent handles;
 * only X and Y are meaningful for 2D path motion.
 */
public final class Vector3 {

    public static final Vector3 ZERO = new Vector3(0, 0, 0);

    public final double x;
    public final double y;
    public final double z;

    public Vector3(double x, double y, double z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Vector3)) return false;
        Vector3 v = (Vector3) o;
        return Double.compare(x, v.x) == 0
            && Double.compare(y, v.y) == 0
            && Double.compare(z, v.z) == 0;
    }

    @Override
    public int hashCode() {
        int h = Double.hashCode(x);
        h = 31 * h + Double.hashCode(y);
        return 31 * h + Double.hashCode(z);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ", " + z + ")";
    }
}
