package com.eainde.extraction.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One field returned by the extraction service for a segment.
 *
 * @param name       field name, e.g. {@code base_rent}
 * @param value      extracted value as text
 * @param excerpt    verbatim source excerpt supporting the value, may be empty
 * @param confidence service-reported confidence in {@code [0, 1]}
 * @param category   result category the field is filed under, e.g. {@code financial}
 */
public record ExtractedField(
        @JsonProperty("name")       String name,
        @JsonProperty("value")      String value,
        @JsonProperty("excerpt")    String excerpt,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("category")   String category
) {

    public ExtractedField {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("field name must not be blank");
        if (value == null) throw new IllegalArgumentException("field value must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1]: " + confidence);
        }
        if (excerpt == null) excerpt = "";
    }
}
