package com.clinic.scheduling.recurrence;

import java.time.Instant;

/** One concrete {@code [start, end)} instance of an availability record. */
public record Occurrence(Instant start, Instant end) {

    public boolean overlaps(Instant otherStart, Instant otherEnd) {
        return start.isBefore(otherEnd) && end.isAfter(otherStart);
    }
}
