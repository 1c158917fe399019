package com.clinic.scheduling.entity;

/**
 * How a resource may be held by overlapping reservations.
 *
 * <ul>
 *   <li>{@link #EXCLUSIVE}: no two live reservations may overlap</li>
 *   <li>{@link #SHARED}: overlapping reservations allowed up to the effective
 *       max-concurrency at every instant</li>
 * </ul>
 */
public enum ReservationMode {
    EXCLUSIVE,
    SHARED
}
