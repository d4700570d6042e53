package com.eainde.extraction.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Differing values reported for the same field within one pass.
 *
 * @param fieldName   field in conflict
 * @param passName    pass that produced the candidates
 * @param chosenValue value picked by the tie-break
 * @param resolution  which tie-break rule decided, e.g. {@code higher confidence}
 * @param candidates  every candidate, winner included, in tie-break order
 */
public record FieldConflict(
        @JsonProperty("field")        String fieldName,
        @JsonProperty("pass")         String passName,
        @JsonProperty("chosen_value") String chosenValue,
        @JsonProperty("resolution")   String resolution,
        @JsonProperty("candidates")   List<Candidate> candidates
) {

    public FieldConflict {
        candidates = List.copyOf(candidates);
    }

    /**
     * One distinct value and the sources that reported it.
     */
    public record Candidate(
            @JsonProperty("value")        String value,
            @JsonProperty("confidence")   double confidence,
            @JsonProperty("attributions") List<SourceAttribution> attributions
    ) {
        public Candidate {
            attributions = List.copyOf(attributions);
        }
    }
}
