package com.clinic.scheduling.service.model;

import com.clinic.scheduling.entity.ReservationMode;

import java.time.Instant;

/**
 * An existing live reservation that prevents a resource from being booked for a window.
 */
public record ResourceConflict(
    Long resourceId,
    Long appointmentId,
    Instant reservedStart,
    Instant reservedEnd,
    ReservationMode mode
) {}
