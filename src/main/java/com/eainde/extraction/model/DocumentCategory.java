package com.eainde.extraction.model;

import java.util.Locale;

/**
 * Lease category declared by the caller. Selects the expected-field set and
 * category-specific classifier keywords and pass applicability.
 */
public enum DocumentCategory {
    RETAIL,
    OFFICE,
    INDUSTRIAL,
    GENERAL;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return the matching category, {@link #GENERAL} for anything unknown
     */
    public static DocumentCategory fromKey(String text) {
        if (text == null) return GENERAL;
        for (DocumentCategory category : values()) {
            if (category.name().equalsIgnoreCase(text.trim())) return category;
        }
        return GENERAL;
    }
}
