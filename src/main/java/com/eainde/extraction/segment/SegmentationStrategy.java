package com.eainde.extraction.segment;

import java.util.List;

/**
 * Splits document text into contiguous spans.
 *
 * <p>Implementations must return spans ordered by start that tile
 * {@code [0, text.length())} with no gaps; {@link DocumentSegmenter} verifies
 * this and degrades to another strategy when it does not hold.</p>
 */
interface SegmentationStrategy {

    SegmentationMode mode();

    List<TextSpan> split(String text, SegmentationPolicy policy);
}
