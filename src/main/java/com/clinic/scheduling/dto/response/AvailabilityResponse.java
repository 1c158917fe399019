package com.clinic.scheduling.dto.response;

import com.clinic.scheduling.entity.AvailabilityType;
import com.clinic.scheduling.entity.ReservationMode;
import com.clinic.scheduling.recurrence.RecurrencePattern;

import java.time.Instant;

public record AvailabilityResponse(
    Long id,
    Long resourceId,
    Instant startTime,
    Instant endTime,
    AvailabilityType availabilityType,
    RecurrencePattern recurrencePattern,
    ReservationMode reservationModeOverride,
    Integer maxConcurrentOverride,
    String reason,
    String createdBy
) {}
