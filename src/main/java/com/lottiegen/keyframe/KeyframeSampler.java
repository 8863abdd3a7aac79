package com.lottiegen.keyframe;

import java.util.List;

/**
 * Evaluates scalar timelines at arbitrary frames.
 *
 * <h3>Sampling rules</h3>
 * <ul>
 *   <li>Static timelines ({@link Animatable#isAnimated()} false) always yield
 *       {@link Animatable#initialValue}.</li>
 *   <li>Before the first keyframe the initial value is in effect.</li>
 *   <li>At or after the last keyframe its value holds.</li>
 *   <li>Between keyframes {@code k0} and {@code k1} the value ramps from {@code k0.value}
 *       to {@code k1.value} shaped by {@code k1.easing}.</li>
 * </ul>
 */
public final class KeyframeSampler {

    private KeyframeSampler() {} // utility class

    public static double sample(Animatable<Double> animatable, double frame) {
        if (!animatable.isAnimated()) return animatable.initialValue;
        return sample(animatable.initialValue, animatable.keyframes, frame);
    }

    public static double sample(double initialValue, List<Keyframe<Double>> keyframes, double frame) {
        int n = keyframes.size();
        if (n == 0) return initialValue;

        if (frame < keyframes.get(0).frame)     return initialValue;
        if (frame >= keyframes.get(n - 1).frame) return keyframes.get(n - 1).value;

        // Find bracketing pair via linear scan (lists are typically small)
        int hi = 1;
        while (hi < n && keyframes.get(hi).frame <= frame) hi++;
        Keyframe<Double> k0 = keyframes.get(hi - 1);
        Keyframe<Double> k1 = keyframes.get(hi);

        double localT = (frame - k0.frame) / (k1.frame - k0.frame);
        return lerp(k0.value, k1.value, k1.easing.ease(localT));
    }

    private static double lerp(double a, double b, double t) {
        if (t == 0) return a; // keep exact values when not moving
        if (t == 1) return b;
        return a + (b - a) * t;
    }
}
