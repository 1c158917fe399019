package com.clinic.scheduling.entity;

/**
 * Lifecycle states for a {@link ProcedureSlot}. Stored via {@code EnumType.STRING}.
 */
public enum SlotStatus {
    AVAILABLE,
    BOOKED,
    CANCELLED,
    BLOCKED
}
