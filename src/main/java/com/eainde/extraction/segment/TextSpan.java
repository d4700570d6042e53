package com.eainde.extraction.segment;

/**
 * Half-open character range {@code [start, end)} produced by a segmentation strategy.
 */
record TextSpan(int start, int end, boolean table) {

    TextSpan(int start, int end) {
        this(start, end, false);
    }

    int length() {
        return end - start;
    }

    boolean isBlank(String text) {
        for (int i = start; i < end; i++) {
            if (!Character.isWhitespace(text.charAt(i))) return false;
        }
        return true;
    }
}
