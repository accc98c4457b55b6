package com.flaggame.dailychallenge.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flaggame.dailychallenge.model.AcceptedAnswer;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link AcceptedAnswer} as a JSON column
 */
@Converter
public class AcceptedAnswerConverter implements AttributeConverter<AcceptedAnswer, String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(AcceptedAnswer answer) {
        if (answer == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(answer);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize accepted answer", e);
        }
    }

    @Override
    public AcceptedAnswer convertToEntityAttribute(String json) {
        if (json == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readValue(json, AcceptedAnswer.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read accepted answer", e);
        }
    }
}
