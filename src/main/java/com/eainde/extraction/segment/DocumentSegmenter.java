package com.eainde.extraction.segment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits lease text into bounded, contiguous segments with a fixed-size
 * overlap carried between neighbours.
 *
 * <h3>Guarantees</h3>
 * <ul>
 *   <li>The own spans of the returned segments tile {@code [0, text.length())}
 *       in order, with no gap and no overlap.</li>
 *   <li>No segment text, overlap prefix included, is longer than {@code maxChars}.</li>
 *   <li>Segmentation never fails. When the requested strategy throws or returns
 *       spans that break the guarantees above, the segmenter falls back to
 *       paragraph accumulation and, as a last resort, fixed-width cuts, and
 *       marks the result as degraded.</li>
 * </ul>
 *
 * <h3>Usage:</h3>
 * <pre>
 * DocumentSegmenter segmenter = DocumentSegmenter.builder()
 *         .targetChars(5_000)
 *         .maxChars(10_000)
 *         .overlapChars(200)
 *         .build();
 *
 * SegmentationResult result = segmenter.segment(leaseText, SegmentationMode.LAYOUT_AWARE);
 * </pre>
 *
 * <p>Pure logic with no Spring dependencies. Instances are immutable and can be shared.</p>
 */
public class DocumentSegmenter {

    private static final Logger log = LoggerFactory.getLogger(DocumentSegmenter.class);

    private final SegmentationPolicy policy;
    private final SegmentationStrategy layoutStrategy;
    private final SegmentationStrategy paragraphStrategy = new ParagraphStrategy();
    private final SegmentationStrategy fixedWidthStrategy = new FixedWidthStrategy();

    private DocumentSegmenter(Builder builder) {
        this.policy = new SegmentationPolicy(builder.targetChars, builder.maxChars, builder.overlapChars,
                builder.tableMinRows, builder.smallParagraphChars);
        this.layoutStrategy = builder.layoutStrategy != null ? builder.layoutStrategy : new LayoutAwareStrategy();
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Segments the document with the requested strategy, degrading if needed.
     *
     * @param text document text; {@code null} or empty yields zero segments
     * @param mode strategy to try first
     * @return segments plus the strategy actually used
     */
    public SegmentationResult segment(String text, SegmentationMode mode) {
        if (text == null || text.isEmpty()) {
            log.info("Empty document, no segments produced");
            return new SegmentationResult(List.of(), mode, mode, false, null);
        }

        PageIndex pageIndex = PageIndex.of(text);
        if (text.length() <= policy.targetChars()) {
            log.info("Document of {} chars fits in a single segment", text.length());
            List<TextSpan> single = List.of(new TextSpan(0, text.length(), false));
            return new SegmentationResult(toSegments(text, single, pageIndex), mode, mode, false, null);
        }

        String reason = null;
        for (SegmentationStrategy strategy : chainFor(mode)) {
            List<TextSpan> spans;
            try {
                spans = absorbBlankSpans(text, strategy.split(text, policy));
            } catch (RuntimeException e) {
                reason = strategy.mode() + " strategy failed: " + e.getMessage();
                log.warn("Segmentation with {} failed, falling back", strategy.mode(), e);
                continue;
            }

            String violation = checkInvariants(text, spans);
            if (violation != null) {
                reason = strategy.mode() + " strategy produced invalid spans: " + violation;
                log.warn("Segmentation with {} produced invalid spans ({}), falling back", strategy.mode(), violation);
                continue;
            }

            List<Segment> segments = toSegments(text, spans, pageIndex);
            boolean degraded = strategy.mode() != mode;
            log.info("Document of {} chars split into {} segments (mode={}, target={}, max={}, overlap={}, pages={})",
                    text.length(), segments.size(), strategy.mode(), policy.targetChars(), policy.maxChars(),
                    policy.overlapChars(), pageIndex.pageCount());
            for (Segment segment : segments) {
                log.debug("  {}", segment);
            }
            return new SegmentationResult(segments, mode, strategy.mode(), degraded, degraded ? reason : null);
        }

        // Fixed-width cuts cannot break the invariants; reaching here means a bug.
        throw new IllegalStateException("All segmentation strategies failed: " + reason);
    }

    public SegmentationPolicy policy() {
        return policy;
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private List<SegmentationStrategy> chainFor(SegmentationMode mode) {
        return switch (mode) {
            case LAYOUT_AWARE -> List.of(layoutStrategy, paragraphStrategy, fixedWidthStrategy);
            case PARAGRAPH -> List.of(paragraphStrategy, fixedWidthStrategy);
            case FIXED_WIDTH -> List.of(fixedWidthStrategy);
        };
    }

    /**
     * Joins whitespace-only spans to a neighbour that still fits the maximum.
     */
    private List<TextSpan> absorbBlankSpans(String text, List<TextSpan> spans) {
        if (spans == null) throw new IllegalStateException("strategy returned null");
        List<TextSpan> result = new ArrayList<>(spans.size());
        for (int i = 0; i < spans.size(); i++) {
            TextSpan span = spans.get(i);
            if (span.isBlank(text) && spans.size() > 1) {
                if (!result.isEmpty()) {
                    TextSpan previous = result.get(result.size() - 1);
                    if (span.end() - previous.start() <= policy.maxChars()) {
                        result.set(result.size() - 1, new TextSpan(previous.start(), span.end(), previous.table()));
                        continue;
                    }
                }
                if (i + 1 < spans.size()) {
                    TextSpan next = spans.get(i + 1);
                    if (next.end() - span.start() <= policy.maxChars() && next.start() == span.end()) {
                        result.add(new TextSpan(span.start(), next.end(), next.table()));
                        i++;
                        continue;
                    }
                }
            }
            result.add(span);
        }
        return result;
    }

    /**
     * @return a description of the first broken guarantee, or {@code null}
     */
    private String checkInvariants(String text, List<TextSpan> spans) {
        if (spans.isEmpty()) return "no spans";
        int expectedStart = 0;
        for (TextSpan span : spans) {
            if (span.start() != expectedStart) {
                return "gap or overlap at offset " + expectedStart;
            }
            if (span.end() <= span.start()) {
                return "empty span at offset " + span.start();
            }
            if (span.length() > policy.maxChars()) {
                return "span [" + span.start() + ", " + span.end() + ") exceeds " + policy.maxChars();
            }
            expectedStart = span.end();
        }
        if (expectedStart != text.length()) {
            return "spans end at " + expectedStart + " of " + text.length();
        }
        return null;
    }

    private List<Segment> toSegments(String text, List<TextSpan> spans, PageIndex pageIndex) {
        List<Segment> segments = new ArrayList<>(spans.size());
        for (int i = 0; i < spans.size(); i++) {
            TextSpan span = spans.get(i);
            int overlapStart = i == 0 ? span.start() : overlapStart(text, spans.get(i - 1), span);
            segments.add(new Segment(
                    Segment.idFor(i),
                    i,
                    text.substring(overlapStart, span.end()),
                    span.start(),
                    span.end(),
                    span.start() - overlapStart,
                    SegmentCategory.UNCLASSIFIED,
                    pageIndex.spanOf(span.start(), span.end()),
                    span.table()));
        }
        return segments;
    }

    /**
     * Start of the overlap copied from {@code previous}, moved forward to a word start.
     */
    private int overlapStart(String text, TextSpan previous, TextSpan current) {
        int overlap = Math.min(policy.overlapChars(),
                Math.min(policy.maxChars() - current.length(), previous.length()));
        if (overlap <= 0) return current.start();

        int start = current.start() - overlap;
        while (start > 0 && start < current.start() && !Character.isWhitespace(text.charAt(start - 1))) {
            start++;
        }
        while (start < current.start() && Character.isWhitespace(text.charAt(start))) {
            start++;
        }
        return start;
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a segmenter with the default limits (5,000 target, 10,000 max, 200 overlap).
     */
    public static DocumentSegmenter withDefaults() {
        return builder().build();
    }

    public static DocumentSegmenter of(SegmentationPolicy policy) {
        return builder()
                .targetChars(policy.targetChars())
                .maxChars(policy.maxChars())
                .overlapChars(policy.overlapChars())
                .tableMinRows(policy.tableMinRows())
                .smallParagraphChars(policy.smallParagraphChars())
                .build();
    }

    public static class Builder {
        private int targetChars = SegmentationPolicy.DEFAULTS.targetChars();
        private int maxChars = SegmentationPolicy.DEFAULTS.maxChars();
        private int overlapChars = SegmentationPolicy.DEFAULTS.overlapChars();
        private int tableMinRows = SegmentationPolicy.DEFAULTS.tableMinRows();
        private int smallParagraphChars = SegmentationPolicy.DEFAULTS.smallParagraphChars();
        private SegmentationStrategy layoutStrategy;

        /**
         * Size at which a segment is flushed. Default: 5,000.
         */
        public Builder targetChars(int targetChars) {
            this.targetChars = targetChars;
            return this;
        }

        /**
         * Hard ceiling on segment text, overlap included. Default: 10,000.
         */
        public Builder maxChars(int maxChars) {
            this.maxChars = maxChars;
            return this;
        }

        /**
         * Tail of each segment repeated at the head of the next. Default: 200.
         * Must be less than targetChars.
         */
        public Builder overlapChars(int overlapChars) {
            this.overlapChars = overlapChars;
            return this;
        }

        public Builder tableMinRows(int tableMinRows) {
            this.tableMinRows = tableMinRows;
            return this;
        }

        public Builder smallParagraphChars(int smallParagraphChars) {
            this.smallParagraphChars = smallParagraphChars;
            return this;
        }

        Builder layoutStrategy(SegmentationStrategy layoutStrategy) {
            this.layoutStrategy = layoutStrategy;
            return this;
        }

        public DocumentSegmenter build() {
            return new DocumentSegmenter(this);
        }
    }
}
