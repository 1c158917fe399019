package com.clinic.scheduling.dto.request;

import java.time.Instant;

/** Exactly one of {@code slotId} and {@code startTime}. */
public record RescheduleAppointmentRequest(
    Long slotId,
    Instant startTime
) {}
