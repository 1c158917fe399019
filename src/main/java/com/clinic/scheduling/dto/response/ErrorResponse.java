package com.clinic.scheduling.dto.response;

import com.clinic.scheduling.service.model.GeneratedSlot;
import com.clinic.scheduling.service.model.ResourceConflict;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
    int status,
    String error,
    String message,
    Instant timestamp,
    String path,
    List<FieldError> fieldErrors,
    List<ResourceConflict> conflicts,
    List<GeneratedSlot> alternatives
) {
    public ErrorResponse(int status, String error, String message,
                         Instant timestamp, String path) {
        this(status, error, message, timestamp, path, List.of(), List.of(), List.of());
    }

    public ErrorResponse(int status, String error, String message,
                         Instant timestamp, String path, List<FieldError> fieldErrors) {
        this(status, error, message, timestamp, path, fieldErrors, List.of(), List.of());
    }

    public record FieldError(String field, String message) {}
}
