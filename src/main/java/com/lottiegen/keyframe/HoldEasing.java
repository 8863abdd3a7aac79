package com.lottiegen.keyframe;

/**
 * Holds the previous keyframe's value until the keyframe's frame is reached,
 * then jumps.
 */
public final class HoldEasing extends Easing {

    public static final HoldEasing INSTANCE = new HoldEasing();

    private HoldEasing() {}

    @Override
    public Type getType() { return Type.HOLD; }

    @Override
    public double ease(double t) { return t < 1 ? 0 : 1; }

    @Override
    public boolean equals(Object o) { return o instanceof HoldEasing; }

    @Override
    public int hashCode() { return Type.HOLD.hashCode(); }

    @Override
    public String toString() { return "Hold"; }
}
