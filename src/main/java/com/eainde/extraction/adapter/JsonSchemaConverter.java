package com.eainde.extraction.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Converts JSON Schema documents into langchain4j {@link JsonSchema} response formats,
 * and builds the schema of the extraction response.
 */
public class JsonSchemaConverter {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static final String RESPONSE_SCHEMA_NAME = "LeaseFieldExtraction";

    public static JsonSchema toLangChainSchema(String name, String jsonSchemaString) {
        try {
            JsonNode rootNode = objectMapper.readTree(jsonSchemaString);
            return JsonSchema.builder()
                    .name(name != null ? name : "Schema")
                    .rootElement(parseElement(rootNode))
                    .build();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse JSON Schema string", e);
        }
    }

    /**
     * Schema of {@code {"fields": [{name, value, excerpt, confidence, category}]}}.
     *
     * @param allowedFields field names to enumerate; empty leaves {@code name} free-form
     * @param categories    category keys to enumerate for {@code category}
     */
    public static String extractionResponseSchema(Collection<String> allowedFields, Collection<String> categories) {
        ObjectNode field = objectMapper.createObjectNode().put("type", "object");
        ObjectNode properties = field.putObject("properties");

        ObjectNode name = properties.putObject("name").put("type", "string")
                .put("description", "snake_case field name");
        if (!allowedFields.isEmpty()) addEnum(name, allowedFields);
        properties.putObject("value").put("type", "string").put("description", "extracted value");
        properties.putObject("excerpt").put("type", "string").put("description", "verbatim supporting text");
        properties.putObject("confidence").put("type", "number").put("description", "0.0 to 1.0");
        ObjectNode category = properties.putObject("category").put("type", "string");
        if (!categories.isEmpty()) addEnum(category, categories);
        field.putArray("required").add("name").add("value").add("confidence");

        ObjectNode root = objectMapper.createObjectNode().put("type", "object");
        ObjectNode fields = root.putObject("properties").putObject("fields").put("type", "array");
        fields.set("items", field);
        root.putArray("required").add("fields");
        return root.toString();
    }

    private static void addEnum(ObjectNode node, Collection<String> values) {
        ArrayNode array = node.putArray("enum");
        values.forEach(array::add);
    }

    private static JsonSchemaElement parseElement(JsonNode node) {
        if (!node.has("type")) {
            if (node.has("properties")) return parseObject(node);
            return JsonStringSchema.builder().build();
        }

        String type = node.get("type").asText();

        return switch (type) {
            case "object" -> parseObject(node);
            case "array" -> parseArray(node);
            case "integer" -> JsonIntegerSchema.builder().description(description(node)).build();
            case "number" -> JsonNumberSchema.builder().description(description(node)).build();
            case "boolean" -> JsonBooleanSchema.builder().description(description(node)).build();
            default -> parseString(node);
        };
    }

    private static JsonObjectSchema parseObject(JsonNode node) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder();

        if (node.has("description")) {
            builder.description(node.get("description").asText());
        }

        if (node.has("properties")) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.get("properties").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.addProperty(field.getKey(), parseElement(field.getValue()));
            }
        }

        if (node.has("required") && node.get("required").isArray()) {
            List<String> requiredFields = new ArrayList<>();
            node.get("required").forEach(n -> requiredFields.add(n.asText()));
            builder.required(requiredFields);
        }

        return builder.build();
    }

    private static JsonArraySchema parseArray(JsonNode node) {
        JsonArraySchema.Builder builder = JsonArraySchema.builder();
        if (node.has("description")) builder.description(node.get("description").asText());
        if (node.has("items")) {
            builder.items(parseElement(node.get("items")));
        }
        return builder.build();
    }

    private static JsonSchemaElement parseString(JsonNode node) {
        if (node.has("enum")) {
            List<String> enumValues = new ArrayList<>();
            node.get("enum").forEach(n -> enumValues.add(n.asText()));
            return JsonEnumSchema.builder()
                    .description(description(node))
                    .enumValues(enumValues)
                    .build();
        }

        return JsonStringSchema.builder()
                .description(description(node))
                .build();
    }

    private static String description(JsonNode node) {
        return node.has("description") ? node.get("description").asText() : null;
    }
}
