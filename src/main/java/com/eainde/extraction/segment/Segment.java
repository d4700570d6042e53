package com.eainde.extraction.segment;


/**
 * A bounded span of source document text sent to the extraction service.
 *
 * <p>Segments tile the document: the own spans {@code [startOffset, endOffset)}
 * of consecutive segments are contiguous and together cover the whole text.
 * To keep cross-boundary context, the {@code text} of every segment but the
 * first may start with a copy of the previous segment's tail; that prefix is
 * {@code overlapLength} characters long and is not part of the own span.</p>
 *
 * <pre>
 *   document:  |------ S-001 ------|------ S-002 ------|---- S-003 ----|
 *   S-002.text:            [overlap]------ own ------|
 * </pre>
 *
 * @param id             stable sequence identifier, e.g. {@code S-003}
 * @param index          zero-based position in document order
 * @param text           text sent for extraction (overlap prefix + own text)
 * @param startOffset    inclusive start of the own span in the document
 * @param endOffset      exclusive end of the own span in the document
 * @param overlapLength  number of leading characters of {@code text} copied from the previous segment
 * @param classification category tag, {@link SegmentCategory#UNCLASSIFIED} until the classifier runs
 * @param pageHint       pages the own span lies on, {@code null} when the document carries no page markers
 * @param table          true when the span was detected as a table region
 */
public record Segment(
        String id,
        int index,
        String text,
        int startOffset,
        int endOffset,
        int overlapLength,
        SegmentCategory classification,
        PageSpan pageHint,
        boolean table
) {

    public Segment {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("Invalid span [" + startOffset + ", " + endOffset + ")");
        }
        if (overlapLength < 0 || overlapLength > text.length()) {
            throw new IllegalArgumentException("Invalid overlap length " + overlapLength);
        }
        if (classification == null) classification = SegmentCategory.UNCLASSIFIED;
    }

    public static String idFor(int index) {
        return String.format("S-%03d", index + 1);
    }

    /**
     * @return the text of the own span, without the overlap prefix
     */
    public String ownText() {
        return text.substring(overlapLength);
    }

    public int length() {
        return text.length();
    }

    public boolean hasPageHint() {
        return pageHint != null;
    }

    public Segment withClassification(SegmentCategory category) {
        return new Segment(id, index, text, startOffset, endOffset, overlapLength, category, pageHint, table);
    }

    @Override
    public String toString() {
        return String.format("Segment[%s, chars %d-%d, len=%d, overlap=%d, %s%s%s]",
                id, startOffset, endOffset, text.length(), overlapLength, classification,
                table ? ", table" : "", pageHint != null ? ", " + pageHint : "");
    }
}
