package com.clinic.scheduling.exception;

import com.clinic.scheduling.service.model.GeneratedSlot;

import java.util.List;

/**
 * Booking failed on a conflict; carries alternative candidate slots the caller can offer.
 */
public class BookingConflictException extends ConflictException {

    private final List<GeneratedSlot> alternatives;

    public BookingConflictException(ConflictException cause, List<GeneratedSlot> alternatives) {
        super(cause.getMessage(), cause.getConflicts());
        initCause(cause);
        this.alternatives = List.copyOf(alternatives);
    }

    public List<GeneratedSlot> getAlternatives() {
        return alternatives;
    }
}
