package com.lottiegen.keyframe;

/** Straight-line interpolation. Singleton; has no parameters. */
public final class LinearEasing extends Easing {

    public static final LinearEasing INSTANCE = new LinearEasing();

    private LinearEasing() {}

    @Override
    public Type getType() { return Type.LINEAR; }

    @Override
    public double ease(double t) { return t; }

    @Override
    public boolean equals(Object o) { return o instanceof LinearEasing; }

    @Override
    public int hashCode() { return Type.LINEAR.hashCode(); }

    @Override
    public String toString() { return "Linear"; }
}
