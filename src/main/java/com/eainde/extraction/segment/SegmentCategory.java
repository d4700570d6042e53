package com.eainde.extraction.segment;

import java.util.Locale;

/**
 * Coarse category assigned to a {@link Segment} by the classifier.
 *
 * <p>The vocabulary is fixed. {@link #SIGNATURE} marks attestation blocks
 * (signatures, notary, witness) and is the only category that can gate a
 * segment out of extraction.</p>
 */
public enum SegmentCategory {

    FINANCIAL,
    PARTIES,
    PREMISES,
    TERM,
    USE,
    MAINTENANCE,
    ASSIGNMENT,
    INSURANCE,
    DEFAULT_REMEDIES,
    SIGNATURE,
    UNCLASSIFIED;

    /**
     * Lower-case key used in configuration and in aggregated output, e.g. {@code default_remedies}.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient lookup used when a remote response names a category.
     *
     * @return the matching category, or {@code null} when the text names none
     */
    public static SegmentCategory fromKey(String text) {
        if (text == null || text.isBlank()) return null;
        String normalized = text.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (SegmentCategory category : values()) {
            if (category.name().equals(normalized)) {
                return category;
            }
        }
        return null;
    }
}
