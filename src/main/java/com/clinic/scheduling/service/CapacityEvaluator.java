package com.clinic.scheduling.service;

import com.clinic.scheduling.entity.ReservationMode;
import com.clinic.scheduling.service.model.AvailabilityTimeline;
import com.clinic.scheduling.service.model.BookedInterval;
import com.clinic.scheduling.service.model.ResourceAvailabilityCheck;
import com.clinic.scheduling.service.model.ResourceConflict;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Exclusive: any overlapping reservation is a conflict. Shared: the highest number of
 * reservations overlapping at any single instant of the window, plus the new one, must
 * not exceed the effective capacity. An existing exclusive reservation blocks even a
 * shared resource.
 */
@Component
public class CapacityEvaluator {

    public ResourceAvailabilityCheck evaluate(AvailabilityTimeline timeline, Instant start, Instant end,
                                              List<BookedInterval> bookings) {
        Long resourceId = timeline.resourceId();
        if (timeline.isBlocked(start, end)) {
            return ResourceAvailabilityCheck.unavailable(resourceId,
                "Resource " + resourceId + " is blocked between " + start + " and " + end);
        }
        Optional<AvailabilityTimeline.Coverage> coverage = timeline.coverage(start, end);
        if (coverage.isEmpty()) {
            return ResourceAvailabilityCheck.unavailable(resourceId,
                "Resource " + resourceId + " is not available between " + start + " and " + end);
        }
        ReservationMode mode = coverage.get().mode();
        int capacity = coverage.get().capacity();

        List<BookedInterval> overlapping = bookings.stream()
            .filter(booking -> booking.overlaps(start, end))
            .toList();
        int peak = peakOverlap(overlapping, start, end);
        List<ResourceConflict> conflicts = new ArrayList<>();

        if (mode == ReservationMode.EXCLUSIVE) {
            overlapping.forEach(booking -> conflicts.add(booking.toConflict()));
        } else {
            overlapping.stream()
                .filter(booking -> booking.mode() == ReservationMode.EXCLUSIVE)
                .forEach(booking -> conflicts.add(booking.toConflict()));
            if (conflicts.isEmpty() && peak + 1 > capacity) {
                overlapping.forEach(booking -> conflicts.add(booking.toConflict()));
            }
        }

        if (!conflicts.isEmpty()) {
            String reason = mode == ReservationMode.EXCLUSIVE
                ? "Resource " + resourceId + " is already reserved between " + start + " and " + end
                : "Resource " + resourceId + " is at capacity (" + peak + "/" + capacity + ") between "
                    + start + " and " + end;
            return new ResourceAvailabilityCheck(resourceId, false, mode, capacity, peak, List.copyOf(conflicts), reason);
        }
        return new ResourceAvailabilityCheck(resourceId, true, mode, capacity, peak, List.of(), null);
    }

    /**
     * Highest number of intervals overlapping any instant of {@code [start, end)}.
     * Intervals are half-open, so one ending exactly when another starts does not count twice.
     */
    public static int peakOverlap(List<BookedInterval> intervals, Instant start, Instant end) {
        List<Edge> edges = new ArrayList<>();
        for (BookedInterval interval : intervals) {
            Instant from = interval.start().isBefore(start) ? start : interval.start();
            Instant to = interval.end().isAfter(end) ? end : interval.end();
            if (from.isBefore(to)) {
                edges.add(new Edge(from, 1));
                edges.add(new Edge(to, -1));
            }
        }
        edges.sort(Comparator.comparing(Edge::at).thenComparingInt(Edge::delta));
        int current = 0;
        int peak = 0;
        for (Edge edge : edges) {
            current += edge.delta();
            peak = Math.max(peak, current);
        }
        return peak;
    }

    private record Edge(Instant at, int delta) {}
}
