package com.eainde.extraction.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A field's final value after aggregation.
 *
 * @param name         field name
 * @param value        winning value
 * @param category     result category
 * @param passName     pass that produced the winning value
 * @param confidence   highest confidence among the attributions of the winning value
 * @param attributions every source that reported the winning value, in segment order
 * @param conflicted   true when the producing pass reported differing values
 */
public record ResolvedField(
        @JsonProperty("name")         String name,
        @JsonProperty("value")        String value,
        @JsonProperty("category")     String category,
        @JsonProperty("pass")         String passName,
        @JsonProperty("confidence")   double confidence,
        @JsonProperty("attributions") List<SourceAttribution> attributions,
        @JsonProperty("conflicted")   boolean conflicted
) {

    public ResolvedField {
        attributions = List.copyOf(attributions);
    }
}
