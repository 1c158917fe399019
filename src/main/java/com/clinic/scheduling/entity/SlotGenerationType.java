package com.clinic.scheduling.entity;

/**
 * How a {@link ProcedureSlot} came to exist.
 *
 * <ul>
 *   <li>{@link #MANUAL}: persisted ahead of time by slot generation</li>
 *   <li>{@link #AUTO}: an ephemeral candidate persisted only at booking time</li>
 * </ul>
 */
public enum SlotGenerationType {
    AUTO,
    MANUAL
}
