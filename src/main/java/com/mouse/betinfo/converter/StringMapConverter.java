package com.mouse.betinfo.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.betinfo.utils.LedgerJson;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Map;
import java.util.TreeMap;

/**
 * provider -> version
 */
@Converter
public class StringMapConverter implements AttributeConverter<Map<String, String>, String> {

    private static final TypeReference<TreeMap<String, String>> TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper = LedgerJson.newObjectMapper();

    @Override
    public String convertToDatabaseColumn(Map<String, String> attribute) {
        if (attribute == null || attribute.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(new TreeMap<>(attribute));
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to convert source versions to JSON", e);
        }
    }

    @Override
    public Map<String, String> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank() || dbData.equals("{}")) {
            return new TreeMap<>();
        }
        try {
            return objectMapper.readValue(dbData, TYPE);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to convert JSON to source versions", e);
        }
    }
}
