package com.clinic.scheduling.entity;

/**
 * Kind of availability window. {@link #BLOCKED} always wins over {@link #AVAILABLE}
 * for overlapping instants on the same resource.
 */
public enum AvailabilityType {
    AVAILABLE,
    BLOCKED
}
