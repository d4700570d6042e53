package com.eainde.extraction.segment;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableSet;

/**
 * Cuts at the structural boundary nearest each target-size checkpoint.
 *
 * <p>Tables are never cut through: a table region up to the maximum size
 * becomes its own segment, a larger one is split into row groups of at most
 * the target size. Prose between tables is cut at the boundary (heading,
 * blank-line run, indentation change, page marker) nearest
 * {@code pos + target}, considering only boundaries that leave at least a
 * quarter of the target behind. Without a usable boundary the cut falls back
 * to the nearest sentence end, then whitespace.</p>
 */
final class LayoutAwareStrategy implements SegmentationStrategy {

    @Override
    public SegmentationMode mode() {
        return SegmentationMode.LAYOUT_AWARE;
    }

    @Override
    public List<TextSpan> split(String text, SegmentationPolicy policy) {
        List<TextSpan> tables = TableDetector.detect(text, policy.tableMinRows());
        NavigableSet<Integer> boundaries = BoundaryDetector.detect(text);

        List<TextSpan> spans = new ArrayList<>();
        int pos = 0;
        for (TextSpan table : tables) {
            if (table.start() > pos) splitProse(text, pos, table.start(), boundaries, policy, spans);
            splitTable(text, table, policy, spans);
            pos = table.end();
        }
        if (pos < text.length()) splitProse(text, pos, text.length(), boundaries, policy, spans);

        return mergeSmallProse(spans, policy);
    }

    private void splitProse(String text, int from, int to, NavigableSet<Integer> boundaries,
                            SegmentationPolicy policy, List<TextSpan> out) {
        int pos = from;
        while (to - pos > policy.targetChars()) {
            int limit = Math.min(pos + policy.maxChars(), to);
            int cut = Boundaries.cutNearCheckpoint(text, boundaries.subSet(pos, false, limit, true),
                    pos, limit, pos + policy.targetChars(), policy.targetChars() / 4);
            out.add(new TextSpan(pos, cut));
            pos = cut;
        }
        if (pos < to) out.add(new TextSpan(pos, to));
    }

    private void splitTable(String text, TextSpan table, SegmentationPolicy policy, List<TextSpan> out) {
        if (table.length() <= policy.maxChars()) {
            out.add(table);
            return;
        }
        int pos = table.start();
        while (table.end() - pos > policy.targetChars()) {
            int cut = lastRowEnd(text, pos, Math.min(pos + policy.targetChars(), table.end()));
            if (cut <= pos) {
                cut = Boundaries.cutNearMaximum(text, pos, Math.min(pos + policy.maxChars(), table.end()));
            }
            out.add(new TextSpan(pos, cut, true));
            pos = cut;
        }
        if (pos < table.end()) out.add(new TextSpan(pos, table.end(), true));
    }

    private static int lastRowEnd(String text, int from, int limit) {
        int newline = text.lastIndexOf('\n', limit - 1);
        return newline >= from ? newline + 1 : -1;
    }

    /**
     * Short prose pieces left between tables are joined to their prose neighbour.
     */
    private static List<TextSpan> mergeSmallProse(List<TextSpan> spans, SegmentationPolicy policy) {
        List<TextSpan> merged = new ArrayList<>(spans.size());
        for (TextSpan span : spans) {
            if (!merged.isEmpty()) {
                TextSpan last = merged.get(merged.size() - 1);
                if (!last.table() && !span.table() && span.end() - last.start() <= policy.targetChars()) {
                    merged.set(merged.size() - 1, new TextSpan(last.start(), span.end()));
                    continue;
                }
            }
            merged.add(span);
        }
        return merged;
    }
}
