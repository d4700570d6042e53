package com.eainde.extraction.segment;

import java.util.ArrayList;
import java.util.List;

/**
 * Cuts every target-size window at the last sentence end or whitespace.
 * Cannot violate the size invariants, so it is the terminal fallback.
 */
final class FixedWidthStrategy implements SegmentationStrategy {

    @Override
    public SegmentationMode mode() {
        return SegmentationMode.FIXED_WIDTH;
    }

    @Override
    public List<TextSpan> split(String text, SegmentationPolicy policy) {
        List<TextSpan> spans = new ArrayList<>();
        int pos = 0;
        while (text.length() - pos > policy.targetChars()) {
            int cut = Boundaries.cutNearMaximum(text, pos, pos + policy.targetChars());
            spans.add(new TextSpan(pos, cut));
            pos = cut;
        }
        if (pos < text.length()) spans.add(new TextSpan(pos, text.length()));
        return spans;
    }
}
