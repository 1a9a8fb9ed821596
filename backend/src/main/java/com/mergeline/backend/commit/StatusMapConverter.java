package com.mergeline.backend.commit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stores a context -> status map as JSON text. Insertion order is kept.
 */
@Converter
public class StatusMapConverter implements AttributeConverter<Map<String, CommitStatus>, String> {

    private static final ObjectMapper OM = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, CommitStatus>> TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(Map<String, CommitStatus> attribute) {
        try {
            return OM.writeValueAsString(attribute == null ? Map.of() : attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("could not serialize statuses", e);
        }
    }

    @Override
    public Map<String, CommitStatus> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) return new LinkedHashMap<>();
        try {
            return OM.readValue(dbData, TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("could not read statuses: " + dbData, e);
        }
    }
}
