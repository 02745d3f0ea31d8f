package com.wpanther.licensing.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class LicenseFeaturesConverter implements AttributeConverter<LicenseFeatures, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(LicenseFeatures features) {
        if (features == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(features);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize license features", e);
        }
    }

    @Override
    public LicenseFeatures convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return new LicenseFeatures();
        }
        try {
            return MAPPER.readValue(json, LicenseFeatures.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot read license features", e);
        }
    }
}
