package com.eainde.extraction.aggregate;

import com.eainde.extraction.model.DocumentCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Completeness weights and the expected fields of each document category.
 *
 * @param segmentWeight  weight of the segment success rate
 * @param fieldWeight    weight of the expected-field coverage
 * @param expectedFields expected field names per document category
 */
public record AggregationSettings(
        double segmentWeight,
        double fieldWeight,
        Map<DocumentCategory, List<String>> expectedFields
) {

    public static final List<String> ESSENTIAL_FIELDS = List.of(
            "landlord", "tenant", "premises_address", "commencement_date", "expiration_date", "base_rent",
            "security_deposit", "permitted_use", "maintenance_responsibility", "assignment_rights",
            "insurance_requirements", "default_remedies");

    public AggregationSettings {
        if (segmentWeight < 0 || fieldWeight < 0 || segmentWeight + fieldWeight <= 0) {
            throw new IllegalArgumentException("completeness weights must be >= 0 and not both 0");
        }
        Map<DocumentCategory, List<String>> copy = new EnumMap<>(DocumentCategory.class);
        if (expectedFields != null) expectedFields.forEach((category, fields) -> copy.put(category, List.copyOf(fields)));
        expectedFields = Collections.unmodifiableMap(copy);
    }

    public static AggregationSettings defaults() {
        return new AggregationSettings(0.5, 0.5, defaultExpectedFields());
    }

    public List<String> expectedFieldsFor(DocumentCategory category) {
        return expectedFields.getOrDefault(category, List.of());
    }

    public static Map<DocumentCategory, List<String>> defaultExpectedFields() {
        Map<DocumentCategory, List<String>> map = new EnumMap<>(DocumentCategory.class);
        map.put(DocumentCategory.GENERAL, ESSENTIAL_FIELDS);
        map.put(DocumentCategory.RETAIL, with(ESSENTIAL_FIELDS,
                "operating_hours", "common_area_charges", "percentage_rent"));
        map.put(DocumentCategory.OFFICE, with(ESSENTIAL_FIELDS,
                "building_services", "operating_expenses", "tenant_improvements"));
        map.put(DocumentCategory.INDUSTRIAL, with(ESSENTIAL_FIELDS,
                "environmental_obligations", "hazardous_materials"));
        return map;
    }

    private static List<String> with(List<String> base, String... extra) {
        List<String> fields = new ArrayList<>(base);
        fields.addAll(List.of(extra));
        return List.copyOf(fields);
    }
}
