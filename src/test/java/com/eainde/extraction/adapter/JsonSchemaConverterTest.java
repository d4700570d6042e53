package com.eainde.extraction.adapter;

import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonSchemaConverterTest {

    // --- Tests for toLangChainSchema ---

    @Test
    void toLangChainSchema_shouldParseSimpleObjectWithPrimitives() {
        // Arrange
        String json = """
                {
                  "type": "object",
                  "properties": {
                    "landlord": { "type": "string", "description": "Legal name of the landlord" },
                    "termMonths": { "type": "integer" },
                    "renewable": { "type": "boolean" }
                  },
                  "required": ["landlord"]
                }""";

        // Act
        JsonSchema result = JsonSchemaConverter.toLangChainSchema("Lease", json);

        // Assert
        assertThat(result.name()).isEqualTo("Lease");
        assertThat(result.rootElement()).isInstanceOf(JsonObjectSchema.class);
        JsonObjectSchema root = (JsonObjectSchema) result.rootElement();

        assertThat(root.properties()).containsOnlyKeys("landlord", "termMonths", "renewable");
        JsonSchemaElement landlord = root.properties().get("landlord");
        assertThat(landlord).isInstanceOf(JsonStringSchema.class);
        assertThat(landlord.description()).isEqualTo("Legal name of the landlord");
        assertThat(root.required()).containsExactly("landlord");
    }

    @Test
    void toLangChainSchema_shouldParseArraysOfObjects() {
        // Arrange
        String json = """
                {
                  "type": "object",
                  "properties": {
                    "rentSteps": {
                      "type": "array",
                      "items": { "type": "object", "properties": { "year": { "type": "integer" } } }
                    }
                  }
                }""";

        // Act
        JsonSchema result = JsonSchemaConverter.toLangChainSchema("RentSchedule", json);

        // Assert
        JsonObjectSchema root = (JsonObjectSchema) result.rootElement();
        assertThat(root.properties().get("rentSteps")).isInstanceOf(JsonArraySchema.class);
        JsonArraySchema steps = (JsonArraySchema) root.properties().get("rentSteps");
        assertThat(steps.items()).isInstanceOf(JsonObjectSchema.class);
        assertThat(((JsonObjectSchema) steps.items()).properties()).containsKey("year");
    }

    @Test
    void toLangChainSchema_shouldParseEnums() {
        // Arrange
        String json = """
                { "type": "object",
                  "properties": { "category": { "type": "string", "enum": ["retail", "office"] } } }""";

        // Act
        JsonSchema result = JsonSchemaConverter.toLangChainSchema("EnumTest", json);

        // Assert
        JsonObjectSchema root = (JsonObjectSchema) result.rootElement();
        JsonEnumSchema category = (JsonEnumSchema) root.properties().get("category");
        assertThat(category.enumValues()).containsExactly("retail", "office");
    }

    @Test
    void toLangChainSchema_shouldDefaultTheName() {
        // Act
        JsonSchema result = JsonSchemaConverter.toLangChainSchema(null, "{ \"type\": \"object\" }");

        // Assert
        assertThat(result.name()).isEqualTo("Schema");
    }

    @Test
    void toLangChainSchema_shouldThrowException_whenJsonIsInvalid() {
        // Arrange
        String invalidJson = "{ \"type\": \"object\", ... INVALID SYNTAX ... }";

        // Act & Assert
        assertThatThrownBy(() -> JsonSchemaConverter.toLangChainSchema("FailTest", invalidJson))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Failed to parse JSON Schema string");
    }

    // --- Tests for extractionResponseSchema ---

    @Test
    void extractionResponseSchema_shouldEnumerateAllowedFieldsAndCategories() {
        // Act
        JsonSchema result = JsonSchemaConverter.toLangChainSchema(JsonSchemaConverter.RESPONSE_SCHEMA_NAME,
                JsonSchemaConverter.extractionResponseSchema(List.of("base_rent", "security_deposit"),
                        List.of("financial")));

        // Assert
        JsonObjectSchema root = (JsonObjectSchema) result.rootElement();
        assertThat(root.required()).containsExactly("fields");
        JsonArraySchema fields = (JsonArraySchema) root.properties().get("fields");
        JsonObjectSchema field = (JsonObjectSchema) fields.items();
        assertThat(field.required()).containsExactly("name", "value", "confidence");
        assertThat(((JsonEnumSchema) field.properties().get("name")).enumValues())
                .containsExactly("base_rent", "security_deposit");
        assertThat(((JsonEnumSchema) field.properties().get("category")).enumValues()).containsExactly("financial");
        assertThat(field.properties().get("confidence")).isInstanceOf(JsonNumberSchema.class);
    }

    @Test
    void extractionResponseSchema_shouldLeaveNameFreeWithoutAllowedFields() {
        // Act
        JsonSchema result = JsonSchemaConverter.toLangChainSchema("Free",
                JsonSchemaConverter.extractionResponseSchema(List.of(), List.of("financial")));

        // Assert
        JsonObjectSchema field = (JsonObjectSchema) ((JsonArraySchema)
                ((JsonObjectSchema) result.rootElement()).properties().get("fields")).items();
        assertThat(field.properties().get("name")).isInstanceOf(JsonStringSchema.class);
    }
}
