package com.clinic.scheduling.entity.converter;

import com.clinic.scheduling.entity.MetadataField;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class MetadataSchemaConverter implements AttributeConverter<List<MetadataField>, String> {

    private static final TypeReference<ArrayList<MetadataField>> TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<MetadataField> schema) {
        try {
            return JsonColumns.MAPPER.writeValueAsString(schema == null ? List.of() : schema);
        } catch (JsonProcessingException ex) {
            throw JsonColumns.unreadable("metadata_schema", ex);
        }
    }

    @Override
    public List<MetadataField> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return JsonColumns.MAPPER.readValue(json, TYPE);
        } catch (JsonProcessingException ex) {
            throw JsonColumns.unreadable("metadata_schema", ex);
        }
    }
}
