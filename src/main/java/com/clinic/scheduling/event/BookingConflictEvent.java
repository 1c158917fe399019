package com.clinic.scheduling.event;

import com.clinic.scheduling.service.model.ResourceConflict;

import java.time.Instant;
import java.util.List;

/** A booking attempt failed; raised for staff review. */
public record BookingConflictEvent(
    String tenantId,
    Long procedureId,
    Long slotId,
    Instant requestedStart,
    String contactId,
    String message,
    List<ResourceConflict> conflicts,
    int alternativesOffered
) {}
