package com.lottiegen.optimization;

import com.lottiegen.keyframe.Easing;
import com.lottiegen.keyframe.Keyframe;
import com.lottiegen.keyframe.LinearEasing;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Removes keyframes that do not change what the animation shows.
 *
 * <h3>Rules</h3>
 * <p>Walking the keyframes in order with the value shown before each one:</p>
 * <ul>
 *   <li><b>Landing</b>: the keyframe's value differs from the value before it. Kept as is.</li>
 *   <li><b>Launch</b>: the value is unchanged, but the next keyframe differs, so a ramp
 *       starts here. Kept, with its easing replaced by {@link LinearEasing}; the ramp into
 *       it is flat so the easing cannot be observed.</li>
 *   <li>Otherwise the keyframe sits on a flat run and is dropped.</li>
 * </ul>
 * <p>The last keyframe is kept only if something before it was kept and it changes
 * the value.</p>
 *
 * <p>Results are produced lazily. The returned iterator is single-pass; it never emits
 * more keyframes than it reads, never reorders them, and never invents frames.</p>
 */
public final class KeyframeOptimizer {

    private KeyframeOptimizer() {} // utility class

    /**
     * Nothing is read from {@code keyframes} until the result is first pulled.
     * That first pull throws {@link CanonicalizationException} if there are no keyframes.
     */
    public static <T> Iterator<Keyframe<T>> optimize(T initialValue, Iterable<Keyframe<T>> keyframes) {
        return new OptimizingIterator<>(initialValue, keyframes.iterator());
    }

    /** {@link #optimize} drained into a list. */
    public static <T> List<Keyframe<T>> optimizeToList(T initialValue, Iterable<Keyframe<T>> keyframes) {
        List<Keyframe<T>> out = new ArrayList<>();
        optimize(initialValue, keyframes).forEachRemaining(out::add);
        return out;
    }

    // ── Iterator ──────────────────────────────────────────────────────────────

    private static final class OptimizingIterator<T> implements Iterator<Keyframe<T>> {

        private final Iterator<Keyframe<T>> source;
        private T           previousValue;
        private Keyframe<T> currentKeyframe;   // null until the first pull
        private boolean     atLeastOneWasOutput;
        private boolean     finalFrameChecked;
        private Keyframe<T> pending;

        OptimizingIterator(T initialValue, Iterator<Keyframe<T>> source) {
            this.source        = source;
            this.previousValue = initialValue;
        }

        @Override
        public boolean hasNext() {
            if (pending == null) pending = advance();
            return pending != null;
        }

        @Override
        public Keyframe<T> next() {
            if (!hasNext()) throw new NoSuchElementException();
            Keyframe<T> result = pending;
            pending = null;
            return result;
        }

        private Keyframe<T> advance() {
            if (currentKeyframe == null) {
                if (!source.hasNext())
                    throw new CanonicalizationException("Cannot optimize a timeline with no keyframes");
                currentKeyframe = source.next();
            }

            while (source.hasNext()) {
                Keyframe<T> nextKeyframe = source.next();
                Keyframe<T> output = null;

                if (!currentKeyframe.value.equals(previousValue)) {
                    output = currentKeyframe;
                } else if (!currentKeyframe.value.equals(nextKeyframe.value)) {
                    output = currentKeyframe.easing.getType() == Easing.Type.LINEAR
                            ? currentKeyframe
                            : currentKeyframe.withEasing(LinearEasing.INSTANCE);
                }

                previousValue   = currentKeyframe.value;
                currentKeyframe = nextKeyframe;

                if (output != null) {
                    atLeastOneWasOutput = true;
                    return output;
                }
            }

            if (!finalFrameChecked) {
                finalFrameChecked = true;
                if (atLeastOneWasOutput && !currentKeyframe.value.equals(previousValue))
                    return currentKeyframe;
            }
            return null;
        }
    }
}
