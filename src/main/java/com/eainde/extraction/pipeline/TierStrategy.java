package com.eainde.extraction.pipeline;

import com.eainde.extraction.model.SizeTier;
import com.eainde.extraction.segment.SegmentationMode;

import java.util.EnumMap;
import java.util.Map;

/**
 * Row of the size-indexed strategy table.
 *
 * <pre>
 *   SMALL   layout-aware segmentation   all passes
 *   MEDIUM  paragraph segmentation      all passes
 *   LARGE   paragraph segmentation      expensive passes excluded
 * </pre>
 *
 * @param segmentationMode  strategy tried first
 * @param expensivePasses   whether expensive passes may run
 */
record TierStrategy(SegmentationMode segmentationMode, boolean expensivePasses) {

    static final Map<SizeTier, TierStrategy> TABLE = table();

    static TierStrategy forTier(SizeTier tier) {
        return TABLE.get(tier);
    }

    private static Map<SizeTier, TierStrategy> table() {
        Map<SizeTier, TierStrategy> table = new EnumMap<>(SizeTier.class);
        table.put(SizeTier.SMALL, new TierStrategy(SegmentationMode.LAYOUT_AWARE, true));
        table.put(SizeTier.MEDIUM, new TierStrategy(SegmentationMode.PARAGRAPH, true));
        table.put(SizeTier.LARGE, new TierStrategy(SegmentationMode.PARAGRAPH, false));
        return table;
    }
}
