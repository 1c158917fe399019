package com.clinic.scheduling.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states for an {@link Appointment}.
 *
 * <p>The forward path is {@code SCHEDULED → CONFIRMED → CHECKED_IN → IN_PROGRESS →
 * COMPLETED}. Any non-terminal state may also move to {@link #CANCELLED} or
 * {@link #NO_SHOW}. {@link #COMPLETED}, {@link #CANCELLED} and {@link #NO_SHOW} are
 * terminal.
 */
public enum AppointmentStatus {
    SCHEDULED,
    CONFIRMED,
    CHECKED_IN,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED,
    NO_SHOW;

    private static final Set<AppointmentStatus> TERMINAL = EnumSet.of(COMPLETED, CANCELLED, NO_SHOW);

    /** Statuses whose reservations are excluded from conflict and capacity checks. */
    public static final Set<AppointmentStatus> RELEASING = EnumSet.of(CANCELLED, NO_SHOW);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean canTransitionTo(AppointmentStatus target) {
        if (isTerminal()) {
            return false;
        }
        if (target == CANCELLED || target == NO_SHOW) {
            return true;
        }
        return switch (this) {
            case SCHEDULED -> target == CONFIRMED;
            case CONFIRMED -> target == CHECKED_IN;
            case CHECKED_IN -> target == IN_PROGRESS;
            case IN_PROGRESS -> target == COMPLETED;
            default -> false;
        };
    }
}
