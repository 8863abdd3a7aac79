package com.lottiegen.data;

/**
 * Immutable ARGB color. Channels are in the 0..1 range as parsed from the source
 * document; no clamping is applied here.
 */
public final class Color {

    public final double a;
    public final double r;
    public final double g;
    public final double b;

    public Color(double a, double r, double g, double b) {
        this.a = a;
        this.r = r;
        this.g = g;
        this.b = b;
    }

    /** Opaque color from RGB channels. */
    public static Color fromRgb(double r, double g, double b) {
        return new Color(1, r, g, b);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Color)) return false;
        Color c = (Color) o;
        return Double.compare(a, c.a) == 0
            && Double.compare(r, c.r) == 0
            && Double.compare(g, c.g) == 0
            && Double.compare(b, c.b) == 0;
    }

    @Override
    public int hashCode() {
        int h = Double.hashCode(a);
        h = 31 * h + Double.hashCode(r);
        h = 31 * h + Double.hashCode(g);
        return 31 * h + Double.hashCode(b);
    }

    @Override
    public String toString() {
        return String.format("Color(a=%s, r=%s, g=%s, b=%s)", a, r, g, b);
    }
}
