package com.eainde.extraction.segment;

import java.util.NavigableSet;

/**
 * Cut-point helpers shared by the segmentation strategies.
 *
 * <p>Every method returns a position {@code p} with {@code from < p <= limit},
 * so callers always make progress.</p>
 */
final class Boundaries {

    private static final String SENTENCE_TERMINATORS = ".!?;";

    private Boundaries() {
    }

    /**
     * Cut at the sentence end closest to {@code limit}; falls back to the last
     * whitespace, then to {@code limit} itself.
     */
    static int cutNearMaximum(String text, int from, int limit) {
        int sentence = lastSentenceEnd(text, from, limit);
        if (sentence > from) return sentence;
        int space = lastWhitespace(text, from, limit);
        if (space > from) return space;
        return limit;
    }

    /**
     * Cut at the structural boundary closest to {@code checkpoint} within
     * {@code [from + minPiece, limit]}. Without a usable boundary, cuts at the
     * sentence end closest to the checkpoint, then at {@link #cutNearMaximum}.
     */
    static int cutNearCheckpoint(String text, NavigableSet<Integer> boundaries,
                                 int from, int limit, int checkpoint, int minPiece) {
        int lowest = Math.min(limit, from + Math.max(1, minPiece));
        Integer below = boundaries.floor(checkpoint);
        Integer above = boundaries.ceiling(checkpoint);
        Integer best = null;
        if (below != null && below >= lowest && below <= limit) best = below;
        if (above != null && above >= lowest && above <= limit) {
            if (best == null || (above - checkpoint) < (checkpoint - best)) best = above;
        }
        if (best != null) return best;

        int sentence = sentenceEndNear(text, lowest, limit, checkpoint);
        if (sentence > from) return sentence;
        return cutNearMaximum(text, from, limit);
    }

    /**
     * @return position just after "terminator + whitespace", or -1
     */
    static int lastSentenceEnd(String text, int from, int limit) {
        for (int i = Math.min(limit, text.length()); i >= from + 2; i--) {
            if (isSentenceEndAt(text, i)) return i;
        }
        return -1;
    }

    static int lastWhitespace(String text, int from, int limit) {
        for (int i = Math.min(limit, text.length()); i > from; i--) {
            if (Character.isWhitespace(text.charAt(i - 1))) return i;
        }
        return -1;
    }

    private static int sentenceEndNear(String text, int lowest, int limit, int checkpoint) {
        int span = Math.max(checkpoint - lowest, limit - checkpoint);
        for (int d = 0; d <= span; d++) {
            int back = checkpoint - d;
            if (back >= lowest && back <= limit && isSentenceEndAt(text, back)) return back;
            int forward = checkpoint + d;
            if (forward >= lowest && forward <= limit && isSentenceEndAt(text, forward)) return forward;
        }
        return -1;
    }

    private static boolean isSentenceEndAt(String text, int i) {
        if (i < 2 || i > text.length()) return false;
        return Character.isWhitespace(text.charAt(i - 1))
                && SENTENCE_TERMINATORS.indexOf(text.charAt(i - 2)) >= 0;
    }
}
