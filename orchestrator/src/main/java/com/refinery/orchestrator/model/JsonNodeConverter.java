package com.refinery.orchestrator.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores structured payloads (metadata, details, result) as JSON text.
 *
 * JsonNode is a closed tree of null/boolean/number/string/array/object nodes,
 * so what goes into the column comes back out unchanged.
 */
@Converter
public class JsonNodeConverter implements AttributeConverter<JsonNode, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(JsonNode node) {
        if (node == null) return null;
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise JSON column", e);
        }
    }

    @Override
    public JsonNode convertToEntityAttribute(String column) {
        if (column == null || column.isBlank()) return null;
        try {
            return MAPPER.readTree(column);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not parse JSON column", e);
        }
    }
}
