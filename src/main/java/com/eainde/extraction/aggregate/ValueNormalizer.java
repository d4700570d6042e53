package com.eainde.extraction.aggregate;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes values so that trivially different spellings of the same value
 * ({@code "$5,000.00 "} and {@code "$5,000.00."}) merge into one candidate.
 */
final class ValueNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String EDGE_PUNCTUATION = "\"'`.,;:";

    private ValueNormalizer() {
    }

    static String normalize(String value) {
        if (value == null) return "";
        String collapsed = WHITESPACE.matcher(value.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
        int start = 0;
        int end = collapsed.length();
        while (start < end && EDGE_PUNCTUATION.indexOf(collapsed.charAt(start)) >= 0) start++;
        while (end > start && EDGE_PUNCTUATION.indexOf(collapsed.charAt(end - 1)) >= 0) end--;
        return collapsed.substring(start, end).trim();
    }
}
