package com.lottiegen.keyframe;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.lottiegen.data.Vector2;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class AnimatableTest {

    private static Keyframe<Double> kf(double frame, double value) {
        return new Keyframe<>(frame, value, LinearEasing.INSTANCE);
    }

    @Test
    public void singleKeyframe_isNotAnimated() {
        assertThat(Animatable.ofStatic(3.0, 1).isAnimated()).isFalse();
    }

    @Test
    public void keyframesAllEqualToInitialValue_isNotAnimated() {
        Animatable<Double> a = new Animatable<>(1.0, Arrays.asList(kf(0, 1), kf(5, 1), kf(9, 1)), null);
        assertThat(a.isAnimated()).isFalse();
    }

    @Test
    public void changingKeyframe_isAnimated() {
        Animatable<Double> a = new Animatable<>(1.0, Arrays.asList(kf(0, 1), kf(5, 2)), null);
        assertThat(a.isAnimated()).isTrue();
    }

    @Test
    public void nonIncreasingFrames_areRejected() {
        List<Keyframe<Double>> frames = Arrays.asList(kf(0, 1), kf(5, 2), kf(5, 3));
        assertThrows(IllegalArgumentException.class, () -> new Animatable<>(1.0, frames, null));
    }

    @Test
    public void keyframeList_isUnmodifiable() {
        Animatable<Double> a = new Animatable<>(1.0, Arrays.asList(kf(0, 1), kf(5, 2)), null);
        assertThrows(UnsupportedOperationException.class, () -> a.keyframes.add(kf(10, 3)));
    }

    @Test
    public void modelEquality_includesPropertyIndex() {
        List<Keyframe<Double>> frames = Arrays.asList(kf(0, 1), kf(5, 2));
        assertThat(new Animatable<>(1.0, frames, 4)).isEqualTo(new Animatable<>(1.0, frames, 4));
        assertThat(new Animatable<>(1.0, frames, 4)).isNotEqualTo(new Animatable<>(1.0, frames, 5));
    }

    @Test
    public void easingEquality_isByTypeAndParameters() {
        Easing e1 = new CubicBezierEasing(new Vector2(0.4, 0), new Vector2(0.6, 1));
        Easing e2 = new CubicBezierEasing(new Vector2(0.4, 0), new Vector2(0.6, 1));
        Easing e3 = new CubicBezierEasing(new Vector2(0.1, 0), new Vector2(0.6, 1));
        assertThat(e1).isEqualTo(e2);
        assertThat(e1.hashCode()).isEqualTo(e2.hashCode());
        assertThat(e1).isNotEqualTo(e3);
        assertThat(LinearEasing.INSTANCE).isNotEqualTo(HoldEasing.INSTANCE);
    }
}
