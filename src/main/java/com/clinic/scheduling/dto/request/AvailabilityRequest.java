package com.clinic.scheduling.dto.request;

import com.clinic.scheduling.entity.AvailabilityType;
import com.clinic.scheduling.entity.ReservationMode;
import com.clinic.scheduling.recurrence.RecurrencePattern;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;

/** Create or full update of an availability window; {@code [startTime, endTime)} is the first occurrence. */
public record AvailabilityRequest(

    @NotNull(message = "Resource ID is required")
    Long resourceId,

    @NotNull(message = "Start time is required")
    Instant startTime,

    @NotNull(message = "End time is required")
    Instant endTime,

    @NotNull(message = "Availability type is required")
    AvailabilityType availabilityType,

    RecurrencePattern recurrencePattern,

    ReservationMode reservationModeOverride,

    @Min(value = 1, message = "Max concurrent override must be at least 1")
    Integer maxConcurrentOverride,

    @Size(max = 255, message = "Reason must not exceed 255 characters")
    String reason,

    @Size(max = 64, message = "Created by must not exceed 64 characters")
    String createdBy
) {}
