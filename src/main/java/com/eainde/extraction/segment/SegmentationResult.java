package com.eainde.extraction.segment;

import java.util.List;

/**
 * Output of {@link DocumentSegmenter#segment(String, SegmentationMode)}.
 *
 * @param segments      segments in document order, empty for an empty document
 * @param requestedMode strategy asked for by the caller
 * @param usedMode      strategy that produced the segments
 * @param degraded      true when the requested strategy failed and a fallback was used
 * @param reason        why the segmenter degraded, {@code null} otherwise
 */
public record SegmentationResult(
        List<Segment> segments,
        SegmentationMode requestedMode,
        SegmentationMode usedMode,
        boolean degraded,
        String reason
) {

    public SegmentationResult {
        segments = List.copyOf(segments);
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public int size() {
        return segments.size();
    }
}
