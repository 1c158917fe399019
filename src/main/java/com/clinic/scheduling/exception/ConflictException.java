package com.clinic.scheduling.exception;

import com.clinic.scheduling.service.model.ResourceConflict;

import java.util.List;

/**
 * A resource is double-booked, a shared resource is at capacity, or a slot is no longer
 * bookable. Carries the individual reservations that caused the conflict when known.
 */
public class ConflictException extends RuntimeException {

    private final List<ResourceConflict> conflicts;

    public ConflictException(String message) {
        this(message, List.of());
    }

    public ConflictException(String message, List<ResourceConflict> conflicts) {
        super(message);
        this.conflicts = List.copyOf(conflicts);
    }

    public List<ResourceConflict> getConflicts() {
        return conflicts;
    }
}
