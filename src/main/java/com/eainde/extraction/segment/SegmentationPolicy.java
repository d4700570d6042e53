package com.eainde.extraction.segment;

/**
 * Size limits applied by every segmentation strategy.
 *
 * @param targetChars         size at which a segment is flushed
 * @param maxChars            hard ceiling for segment text, overlap included
 * @param overlapChars        tail of segment n copied into the head of segment n+1
 * @param tableMinRows        consecutive table-like lines needed to treat a region as a table
 * @param smallParagraphChars a paragraph shorter than this is pulled into a segment that already reached target
 */
public record SegmentationPolicy(
        int targetChars,
        int maxChars,
        int overlapChars,
        int tableMinRows,
        int smallParagraphChars
) {

    public static final SegmentationPolicy DEFAULTS = new SegmentationPolicy(5_000, 10_000, 200, 3, 500);

    public SegmentationPolicy {
        if (targetChars < 1) throw new IllegalArgumentException("targetChars must be >= 1");
        if (maxChars < targetChars) {
            throw new IllegalArgumentException(
                    "maxChars (" + maxChars + ") must be >= targetChars (" + targetChars + ")");
        }
        if (overlapChars < 0) throw new IllegalArgumentException("overlapChars must be >= 0");
        if (overlapChars >= targetChars) {
            throw new IllegalArgumentException(
                    "overlapChars (" + overlapChars + ") must be < targetChars (" + targetChars + ")");
        }
        if (tableMinRows < 2) throw new IllegalArgumentException("tableMinRows must be >= 2");
        if (smallParagraphChars < 0) throw new IllegalArgumentException("smallParagraphChars must be >= 0");
    }

    public static SegmentationPolicy of(int targetChars, int maxChars, int overlapChars) {
        return new SegmentationPolicy(targetChars, maxChars, overlapChars,
                DEFAULTS.tableMinRows(), DEFAULTS.smallParagraphChars());
    }
}
