package com.eainde.extraction.segment;

/**
 * How a document was cut into segments.
 */
public enum SegmentationMode {

    /** Headings, blank-line runs, indentation changes; tables kept whole. */
    LAYOUT_AWARE,

    /** Greedy paragraph accumulation; used for large documents. */
    PARAGRAPH,

    /** Fixed-width cuts at sentence or word boundaries. Last resort only. */
    FIXED_WIDTH
}
