package com.clinic.scheduling.entity.converter;

import com.clinic.scheduling.recurrence.RecurrencePattern;
import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class RecurrencePatternConverter implements AttributeConverter<RecurrencePattern, String> {

    @Override
    public String convertToDatabaseColumn(RecurrencePattern pattern) {
        if (pattern == null) {
            return null;
        }
        try {
            return JsonColumns.MAPPER.writerFor(RecurrencePattern.class).writeValueAsString(pattern);
        } catch (JsonProcessingException ex) {
            throw JsonColumns.unreadable("recurrence_pattern", ex);
        }
    }

    @Override
    public RecurrencePattern convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return JsonColumns.MAPPER.readValue(json, RecurrencePattern.class);
        } catch (JsonProcessingException ex) {
            throw JsonColumns.unreadable("recurrence_pattern", ex);
        }
    }
}
