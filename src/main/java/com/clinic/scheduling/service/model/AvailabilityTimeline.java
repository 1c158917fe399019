package com.clinic.scheduling.service.model;

import com.clinic.scheduling.entity.ReservationMode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Concrete availability of one resource over a query window: available windows with the
 * blocked time already cut out, plus the blocked windows themselves.
 */
public final class AvailabilityTimeline {

    private final Long resourceId;
    private final List<AvailabilityWindow> available;
    private final List<AvailabilityWindow> blocked;

    public AvailabilityTimeline(Long resourceId, List<AvailabilityWindow> available, List<AvailabilityWindow> blocked) {
        this.resourceId = resourceId;
        this.available = available.stream().sorted(Comparator.comparing(AvailabilityWindow::start)).toList();
        this.blocked = blocked.stream().sorted(Comparator.comparing(AvailabilityWindow::start)).toList();
    }

    public Long resourceId() {
        return resourceId;
    }

    public List<AvailabilityWindow> available() {
        return available;
    }

    public List<AvailabilityWindow> blocked() {
        return blocked;
    }

    /** Available and blocked windows together, ordered by start. */
    public List<AvailabilityWindow> windows() {
        List<AvailabilityWindow> all = new ArrayList<>(available);
        all.addAll(blocked);
        all.sort(Comparator.comparing(AvailabilityWindow::start).thenComparing(AvailabilityWindow::type));
        return all;
    }

    public boolean isBlocked(Instant start, Instant end) {
        return blocked.stream().anyMatch(window -> window.overlaps(start, end));
    }

    /**
     * Mode and capacity for {@code [start, end)} when the available windows cover it
     * without a gap. Several windows covering parts of the range combine to the lowest
     * capacity, and to exclusive if any of them is exclusive.
     */
    public Optional<Coverage> coverage(Instant start, Instant end) {
        Instant cursor = start;
        ReservationMode mode = ReservationMode.SHARED;
        int capacity = Integer.MAX_VALUE;
        for (AvailabilityWindow window : available) {
            if (!window.overlaps(start, end)) {
                continue;
            }
            if (window.start().isAfter(cursor)) {
                return Optional.empty();
            }
            if (window.mode() == ReservationMode.EXCLUSIVE) {
                mode = ReservationMode.EXCLUSIVE;
            }
            capacity = Math.min(capacity, window.maxConcurrent());
            if (window.end().isAfter(cursor)) {
                cursor = window.end();
            }
            if (!cursor.isBefore(end)) {
                return Optional.of(new Coverage(mode, capacity));
            }
        }
        return Optional.empty();
    }

    public record Coverage(ReservationMode mode, int capacity) {}
}
