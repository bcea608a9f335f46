package com.flagship.escrow_engine.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class FieldChangesConverter implements AttributeConverter<List<FieldChange>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final TypeReference<List<FieldChange>> TYPE = new TypeReference<>() { };

    @Override
    public String convertToDatabaseColumn(List<FieldChange> changes) {
        try {
            return MAPPER.writeValueAsString(changes != null ? changes : List.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize audit changes", e);
        }
    }

    @Override
    public List<FieldChange> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return List.copyOf(MAPPER.readValue(json, TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read audit changes", e);
        }
    }
}
