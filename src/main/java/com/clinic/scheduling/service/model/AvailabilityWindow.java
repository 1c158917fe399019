package com.clinic.scheduling.service.model;

import com.clinic.scheduling.entity.AvailabilityType;
import com.clinic.scheduling.entity.ReservationMode;

import java.time.Instant;

public record AvailabilityWindow(
    Long resourceId,
    Instant start,
    Instant end,
    AvailabilityType type,
    ReservationMode mode,
    int maxConcurrent
) {

    public boolean overlaps(Instant otherStart, Instant otherEnd) {
        return start.isBefore(otherEnd) && end.isAfter(otherStart);
    }
}
