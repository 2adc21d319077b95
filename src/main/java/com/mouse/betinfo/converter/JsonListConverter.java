package com.mouse.betinfo.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.betinfo.utils.LedgerJson;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/**
 * JPA Converter for JSON arrays such as recommended actions or suggested modules
 */
@Converter
public class JsonListConverter implements AttributeConverter<List<Object>, String> {

    private static final TypeReference<ArrayList<Object>> TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper = LedgerJson.newObjectMapper();

    @Override
    public String convertToDatabaseColumn(List<Object> attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(attribute);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to convert list to JSON", e);
        }
    }

    @Override
    public List<Object> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(dbData, TYPE);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to convert JSON to list", e);
        }
    }
}
