package com.lottiegen.optimization;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.lottiegen.data.Vector2;
import com.lottiegen.keyframe.CubicBezierEasing;
import com.lottiegen.keyframe.Easing;
import com.lottiegen.keyframe.HoldEasing;
import com.lottiegen.keyframe.Keyframe;
import com.lottiegen.keyframe.LinearEasing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class KeyframeOptimizerTest {

    private static final Easing EASE = new CubicBezierEasing(new Vector2(0.3, 0), new Vector2(0.7, 1));

    private static Keyframe<String> kf(double frame, String value, Easing easing) {
        return new Keyframe<>(frame, value, easing);
    }

    @Test
    public void neverChangingKeyframes_emitNothing() {
        List<Keyframe<String>> in = Arrays.asList(
                kf(0, "A", EASE), kf(1, "A", EASE), kf(2, "A", EASE));

        assertThat(KeyframeOptimizer.optimizeToList("A", in)).isEmpty();
    }

    @Test
    public void redundantLeadingFrame_isDroppedAndLaunchFrameMadeLinear() {
        Keyframe<String> f0  = kf(0, "A", EASE);
        Keyframe<String> f5  = kf(5, "A", EASE);
        Keyframe<String> f10 = kf(10, "B", EASE);

        List<Keyframe<String>> out = KeyframeOptimizer.optimizeToList("A", Arrays.asList(f0, f5, f10));

        assertThat(out).containsExactly(kf(5, "A", LinearEasing.INSTANCE), f10).inOrder();
        assertThat(out.get(1)).isSameInstanceAs(f10);
    }

    @Test
    public void launchFrameAlreadyLinear_isReusedAsIs() {
        Keyframe<String> f0 = kf(0, "A", LinearEasing.INSTANCE);
        Keyframe<String> f5 = kf(5, "B", HoldEasing.INSTANCE);

        List<Keyframe<String>> out = KeyframeOptimizer.optimizeToList("A", Arrays.asList(f0, f5));

        assertThat(out).hasSize(2);
        assertThat(out.get(0)).isSameInstanceAs(f0);
        assertThat(out.get(1)).isSameInstanceAs(f5);
    }

    @Test
    public void landingFrames_keepTheirEasing() {
        List<Keyframe<String>> in = Arrays.asList(
                kf(0, "A", LinearEasing.INSTANCE),
                kf(5, "B", EASE),
                kf(10, "C", HoldEasing.INSTANCE));

        assertThat(KeyframeOptimizer.optimizeToList("A", in)).containsExactlyElementsIn(in).inOrder();
    }

    @Test
    public void flatTail_isDropped() {
        List<Keyframe<String>> in = Arrays.asList(
                kf(0, "A", LinearEasing.INSTANCE),
                kf(5, "B", EASE),
                kf(10, "B", EASE),
                kf(15, "B", EASE));

        assertThat(KeyframeOptimizer.optimizeToList("A", in))
                .containsExactly(in.get(0), in.get(1)).inOrder();
    }

    @Test
    public void plateauInTheMiddle_keepsOnlyItsLaunchFrame() {
        List<Keyframe<String>> in = Arrays.asList(
                kf(0, "A", LinearEasing.INSTANCE),
                kf(5, "B", EASE),
                kf(10, "B", EASE),
                kf(15, "B", EASE),
                kf(20, "C", EASE));

        assertThat(KeyframeOptimizer.optimizeToList("A", in))
                .containsExactly(in.get(0), in.get(1), kf(15, "B", LinearEasing.INSTANCE), in.get(4))
                .inOrder();
    }

    @Test
    public void returningToThePreviousValue_keepsTheClosingFrame() {
        List<Keyframe<String>> in = Arrays.asList(
                kf(0, "A", LinearEasing.INSTANCE),
                kf(5, "B", EASE),
                kf(10, "A", EASE));

        assertThat(KeyframeOptimizer.optimizeToList("A", in)).containsExactlyElementsIn(in).inOrder();
    }

    @Test
    public void output_isProducedLazily() {
        List<Keyframe<String>> consumed = new ArrayList<>();
        List<Keyframe<String>> in = Arrays.asList(
                kf(0, "A", LinearEasing.INSTANCE),
                kf(5, "B", EASE),
                kf(10, "C", EASE),
                kf(15, "D", EASE));
        Iterable<Keyframe<String>> recording = () -> new Iterator<Keyframe<String>>() {
            private final Iterator<Keyframe<String>> it = in.iterator();
            @Override public boolean hasNext() { return it.hasNext(); }
            @Override public Keyframe<String> next() {
                Keyframe<String> k = it.next();
                consumed.add(k);
                return k;
            }
        };

        Iterator<Keyframe<String>> out = KeyframeOptimizer.optimize("A", recording);
        assertThat(consumed).isEmpty();

        assertThat(out.next()).isSameInstanceAs(in.get(0));
        assertThat(consumed).hasSize(2);
    }

    @Test
    public void emptyInput_failsOnFirstPull() {
        Iterator<Keyframe<String>> out = KeyframeOptimizer.optimize("A", Collections.<Keyframe<String>>emptyList());

        assertThrows(CanonicalizationException.class, out::hasNext);
        assertThrows(CanonicalizationException.class,
                () -> KeyframeOptimizer.optimizeToList("A", Collections.<Keyframe<String>>emptyList()));
    }
}
