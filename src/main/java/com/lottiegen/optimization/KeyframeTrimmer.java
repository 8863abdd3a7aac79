package com.lottiegen.optimization;

import com.lottiegen.keyframe.Keyframe;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Cuts a keyframe sequence down to what is needed to play the frame window
 * {@code [startFrame, endFrame]}.
 *
 * <p>The result holds at most one keyframe at or before {@code startFrame} (the last
 * one, which supplies the starting value), every keyframe inside the window, and the
 * first keyframe at or after {@code endFrame}, after which iteration stops without
 * reading further. A keyframe at frame 0 that falls after {@code startFrame} anchors
 * the timeline and replaces the pending starting keyframe.</p>
 */
public final class KeyframeTrimmer {

    private KeyframeTrimmer() {} // utility class

    public static <T> Iterator<Keyframe<T>> trim(Iterable<Keyframe<T>> keyframes,
                                                 double startFrame, double endFrame) {
        return new TrimmingIterator<>(keyframes.iterator(), startFrame, endFrame);
    }

    private static final class TrimmingIterator<T> implements Iterator<Keyframe<T>> {

        private final Iterator<Keyframe<T>> source;
        private final double startFrame;
        private final double endFrame;

        private final ArrayDeque<Keyframe<T>> pending = new ArrayDeque<>(2);
        private Keyframe<T> firstCandidate;
        private boolean     firstKeyframeReturned;
        private boolean     done;

        TrimmingIterator(Iterator<Keyframe<T>> source, double startFrame, double endFrame) {
            this.source     = source;
            this.startFrame = startFrame;
            this.endFrame   = endFrame;
        }

        @Override
        public boolean hasNext() {
            while (pending.isEmpty() && !done && source.hasNext()) {
                consume(source.next());
            }
            return !pending.isEmpty();
        }

        @Override
        public Keyframe<T> next() {
            if (!hasNext()) throw new NoSuchElementException();
            return pending.poll();
        }

        private void consume(Keyframe<T> keyframe) {
            if (keyframe.frame <= startFrame) {
                firstCandidate = keyframe;
                return;
            }

            if (keyframe.frame == 0) {
                firstCandidate = null;
                firstKeyframeReturned = true;
            } else if (!firstKeyframeReturned && firstCandidate != null) {
                pending.add(firstCandidate);
                firstKeyframeReturned = true;
            }
            pending.add(keyframe);
            if (keyframe.frame >= endFrame) done = true;
        }
    }
}
