package com.eainde.extraction.adapter;

import com.eainde.extraction.model.ExtractedField;
import com.eainde.extraction.pass.ExtractionPass;
import com.eainde.extraction.segment.SegmentCategory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates and parses the raw service payload.
 *
 * <p>Expected shape: {@code {"fields": [{"name", "value", "excerpt"?, "confidence"?, "category"?}]}}.
 * Markdown fences and prose around the JSON object are tolerated. Entries with a
 * {@code null} value are dropped (the service found nothing); a missing name, a
 * non-numeric or out-of-range confidence, or a payload without a {@code fields}
 * array makes the whole response malformed. Names the pass does not allow are dropped.</p>
 */
@Slf4j
public class ExtractionResponseParser {

    static final double DEFAULT_CONFIDENCE = 0.5;

    private final ObjectMapper mapper;

    public ExtractionResponseParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ExtractionResponseParser() {
        this(new ObjectMapper());
    }

    /**
     * @param raw             service payload
     * @param pass            pass the payload answers
     * @param defaultCategory category for entries that name none or an unknown one
     */
    public List<ExtractedField> parse(String raw, ExtractionPass pass, String defaultCategory)
            throws MalformedResponseException {
        if (raw == null || raw.isBlank()) {
            throw new MalformedResponseException("empty response");
        }

        JsonNode root;
        try {
            root = mapper.readTree(cleanJson(raw));
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedResponseException("response is not a JSON object");
        }
        JsonNode entries = root.get("fields");
        if (entries == null || !entries.isArray()) {
            throw new MalformedResponseException("response has no 'fields' array");
        }

        List<ExtractedField> fields = new ArrayList<>();
        int index = 0;
        for (JsonNode entry : entries) {
            ExtractedField field = parseEntry(entry, index++, defaultCategory);
            if (field == null) continue;
            if (!pass.allowsField(field.name())) {
                log.debug("Dropping field '{}' not allowed in pass {}", field.name(), pass.name());
                continue;
            }
            fields.add(field);
        }
        return fields;
    }

    private ExtractedField parseEntry(JsonNode entry, int index, String defaultCategory)
            throws MalformedResponseException {
        if (!entry.isObject()) {
            throw new MalformedResponseException("fields[" + index + "] is not an object");
        }
        JsonNode name = entry.get("name");
        if (name == null || !name.isTextual() || name.asText().isBlank()) {
            throw new MalformedResponseException("fields[" + index + "] has no name");
        }

        JsonNode value = entry.get("value");
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.isValueNode() ? value.asText() : value.toString();
        if (text.isBlank()) {
            return null;
        }

        double confidence = DEFAULT_CONFIDENCE;
        JsonNode confidenceNode = entry.get("confidence");
        if (confidenceNode != null && !confidenceNode.isNull()) {
            if (!confidenceNode.isNumber()) {
                throw new MalformedResponseException("fields[" + index + "].confidence is not a number");
            }
            confidence = confidenceNode.asDouble();
            if (confidence < 0.0 || confidence > 1.0) {
                throw new MalformedResponseException("fields[" + index + "].confidence " + confidence
                        + " is outside [0, 1]");
            }
        }

        JsonNode excerpt = entry.get("excerpt");
        SegmentCategory category = SegmentCategory.fromKey(textOrNull(entry.get("category")));
        String categoryKey = category == null || category == SegmentCategory.SIGNATURE
                || category == SegmentCategory.UNCLASSIFIED ? defaultCategory : category.key();

        return new ExtractedField(name.asText().trim(), text.trim(),
                excerpt == null || excerpt.isNull() ? "" : excerpt.asText(), confidence, categoryKey);
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    /**
     * Strips markdown fences and anything outside the outermost JSON object.
     */
    static String cleanJson(String json) {
        String cleaned = json.replace("```json", "")
                .replace("```", "")
                .trim();
        int open = cleaned.indexOf('{');
        int close = cleaned.lastIndexOf('}');
        if (open >= 0 && close > open) {
            cleaned = cleaned.substring(open, close + 1);
        }
        return cleaned;
    }
}
