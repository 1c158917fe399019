package com.clinic.scheduling.service.model;

import com.clinic.scheduling.entity.ReservationMode;

import java.time.Instant;

/**
 * One resource picked for one role of a candidate slot. {@code quantity} is set for
 * consumables only.
 */
public record ResourceAssignment(
    Long roleId,
    Long resourceId,
    Instant reservedStart,
    Instant reservedEnd,
    ReservationMode mode,
    Integer quantity
) {}
