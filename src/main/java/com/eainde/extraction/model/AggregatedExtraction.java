package com.eainde.extraction.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merged extraction for a whole document. Immutable.
 *
 * @param fieldsByCategory      result category, then field name, to resolved field; both levels sorted by name
 * @param conflicts             every same-pass conflict, with all candidates retained
 * @param missingExpectedFields expected fields for the document category that no segment resolved
 * @param completenessScore     blend of segment success rate and expected-field coverage, in {@code [0, 1]}
 */
public record AggregatedExtraction(
        @JsonProperty("fields_by_category")      Map<String, Map<String, ResolvedField>> fieldsByCategory,
        @JsonProperty("conflicts")               List<FieldConflict> conflicts,
        @JsonProperty("missing_expected_fields") List<String> missingExpectedFields,
        @JsonProperty("completeness_score")      double completenessScore
) {

    public AggregatedExtraction {
        Map<String, Map<String, ResolvedField>> copy = new LinkedHashMap<>();
        fieldsByCategory.forEach((category, fields) ->
                copy.put(category, Collections.unmodifiableMap(new LinkedHashMap<>(fields))));
        fieldsByCategory = Collections.unmodifiableMap(copy);
        conflicts = List.copyOf(conflicts);
        missingExpectedFields = List.copyOf(missingExpectedFields);
        if (completenessScore < 0.0 || completenessScore > 1.0) {
            throw new IllegalArgumentException("completenessScore must be in [0, 1]: " + completenessScore);
        }
    }

    public static AggregatedExtraction empty(List<String> missingExpectedFields) {
        return new AggregatedExtraction(Map.of(), List.of(), missingExpectedFields, 0.0);
    }

    /**
     * Looks a field up by name across all categories.
     */
    public Optional<ResolvedField> field(String name) {
        for (Map<String, ResolvedField> fields : fieldsByCategory.values()) {
            ResolvedField field = fields.get(name);
            if (field != null) return Optional.of(field);
        }
        return Optional.empty();
    }

    public int resolvedFieldCount() {
        return fieldsByCategory.values().stream().mapToInt(Map::size).sum();
    }
}
