package com.clinic.scheduling.recurrence;

public enum RecurrenceType {
    DAILY,
    WEEKLY,
    MONTHLY,
    YEARLY
}
