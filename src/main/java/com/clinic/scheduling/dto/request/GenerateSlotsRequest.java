package com.clinic.scheduling.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.List;

/**
 * Candidate slots must start at or after {@code from} and end at or before {@code to}.
 * {@code intervalMinutes} and {@code maxSlots} fall back to the configured defaults.
 */
public record GenerateSlotsRequest(

    @NotNull(message = "Procedure ID is required")
    Long procedureId,

    @NotNull(message = "From is required")
    Instant from,

    @NotNull(message = "To is required")
    Instant to,

    Long locationResourceId,

    @Min(value = 1, message = "Interval must be at least 1 minute")
    Integer intervalMinutes,

    @Min(value = 1, message = "Max slots must be at least 1")
    @Max(value = 1000, message = "Max slots must not exceed 1000")
    Integer maxSlots,

    List<@Valid PreferenceRequest> preferences
) {}
