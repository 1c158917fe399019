package com.clinic.scheduling.entity.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Jackson mapper shared by the JSON-in-{@code TEXT} attribute converters. Converters are
 * instantiated by Hibernate, not Spring, so they cannot receive the application's
 * {@code ObjectMapper} bean.
 */
final class JsonColumns {

    static final ObjectMapper MAPPER = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    private JsonColumns() {}

    static IllegalStateException unreadable(String column, JsonProcessingException ex) {
        return new IllegalStateException("Cannot map JSON column " + column, ex);
    }
}
