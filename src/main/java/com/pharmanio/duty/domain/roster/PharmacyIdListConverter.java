package com.pharmanio.duty.domain.roster;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/**
 * Stores roster pharmacy ids as a JSON array column, e.g. {@code [7,12,31]}.
 */
@Converter
public class PharmacyIdListConverter implements AttributeConverter<List<Long>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<Long>> ID_LIST = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<Long> ids) {
        if (ids == null) return "[]";
        try {
            return MAPPER.writeValueAsString(ids);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize pharmacy id list", e);
        }
    }

    @Override
    public List<Long> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) return new ArrayList<>();
        try {
            return new ArrayList<>(MAPPER.readValue(json, ID_LIST));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize pharmacy id list", e);
        }
    }
}
