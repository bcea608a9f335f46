package com.flagship.escrow_engine.contract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.List;

/**
 * Stores the extension history as a JSON array.
 */
@Converter
public class ExtensionHistoryConverter implements AttributeConverter<List<ExtensionRecord>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final TypeReference<List<ExtensionRecord>> TYPE = new TypeReference<>() { };

    @Override
    public String convertToDatabaseColumn(List<ExtensionRecord> history) {
        try {
            return MAPPER.writeValueAsString(history != null ? history : List.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize extension history", e);
        }
    }

    @Override
    public List<ExtensionRecord> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return List.copyOf(MAPPER.readValue(json, TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read extension history", e);
        }
    }
}
