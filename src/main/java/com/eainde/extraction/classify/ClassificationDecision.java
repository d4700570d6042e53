package com.eainde.extraction.classify;

import com.eainde.extraction.segment.Segment;
import com.eainde.extraction.segment.SegmentCategory;

import java.util.List;

/**
 * Classifier verdict for one segment.
 *
 * @param segment         the segment with its classification applied
 * @param excluded        true when the segment is gated out of extraction
 * @param confidence      {@code min(1, score / 10)} of the winning category
 * @param matchedKeywords keywords of the winning category found in the text
 * @param reason          one-line explanation, logged with the decision
 */
public record ClassificationDecision(
        Segment segment,
        boolean excluded,
        double confidence,
        List<String> matchedKeywords,
        String reason
) {

    public ClassificationDecision {
        matchedKeywords = List.copyOf(matchedKeywords);
    }

    public SegmentCategory category() {
        return segment.classification();
    }
}
