package com.project.lingodeck.backend.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.project.lingodeck.backend.algorithm.CardContent;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores the card payload as JSON text. The {@code kind} tag written by
 * {@link CardContent} picks the subtype again on read.
 */
@Converter
public class CardContentConverter implements AttributeConverter<CardContent, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(CardContent content) {
        if (content == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize card content: " + e.getMessage(), e);
        }
    }

    @Override
    public CardContent convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(json, CardContent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse card content: " + e.getMessage(), e);
        }
    }
}
