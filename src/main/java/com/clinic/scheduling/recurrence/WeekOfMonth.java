package com.clinic.scheduling.recurrence;

/**
 * Which occurrence of a weekday inside a month ("the second Tuesday", "the last Friday").
 */
public enum WeekOfMonth {
    FIRST(1),
    SECOND(2),
    THIRD(3),
    FOURTH(4),
    LAST(-1);

    private final int ordinal;

    WeekOfMonth(int ordinal) {
        this.ordinal = ordinal;
    }

    /** Ordinal accepted by {@code TemporalAdjusters.dayOfWeekInMonth}; {@code -1} is the last one. */
    public int ordinalInMonth() {
        return ordinal;
    }
}
