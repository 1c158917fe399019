package com.clinic.scheduling.service.model;

import java.time.Instant;
import java.util.List;

/**
 * A bookable start time with the resource combination that makes it bookable.
 * Lower {@code priorityScore} is better.
 */
public record GeneratedSlot(
    Instant startTime,
    Instant endTime,
    List<ResourceAssignment> assignments,
    int priorityScore
) {}
