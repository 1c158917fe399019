package com.clinic.scheduling.service;

import com.clinic.scheduling.entity.MetadataField;
import com.clinic.scheduling.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class MetadataValidator {

    public void validate(List<MetadataField> schema, Map<String, Object> metadata) {
        List<MetadataField> fields = schema == null ? List.of() : schema;
        Map<String, Object> values = metadata == null ? Map.of() : metadata;
        Set<String> declared = fields.stream().map(MetadataField::name).collect(Collectors.toSet());

        List<String> problems = new ArrayList<>();
        values.keySet().stream()
            .filter(key -> !declared.contains(key))
            .sorted()
            .forEach(key -> problems.add("unknown field '" + key + "'"));

        for (MetadataField field : fields) {
            Object value = values.get(field.name());
            if (value == null) {
                if (field.required()) {
                    problems.add("missing required field '" + field.name() + "'");
                }
                continue;
            }
            if (!matches(field, value)) {
                problems.add("field '" + field.name() + "' must be of type " + field.type());
            }
        }

        if (!problems.isEmpty()) {
            throw new ValidationException("Invalid resource metadata: " + String.join("; ", problems));
        }
    }

    private static boolean matches(MetadataField field, Object value) {
        return switch (field.type()) {
            case STRING -> value instanceof String;
            case NUMBER -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
        };
    }
}
