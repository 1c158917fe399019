package com.clinic.scheduling.unit.service;

import com.clinic.scheduling.entity.AvailabilityType;
import com.clinic.scheduling.entity.ReservationMode;
import com.clinic.scheduling.service.CapacityEvaluator;
import com.clinic.scheduling.service.model.AvailabilityTimeline;
import com.clinic.scheduling.service.model.AvailabilityWindow;
import com.clinic.scheduling.service.model.BookedInterval;
import com.clinic.scheduling.service.model.ResourceAvailabilityCheck;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CapacityEvaluatorTest {

    private static final Instant DAY_START = Instant.parse("2025-01-06T08:00:00Z");
    private static final Instant DAY_END = Instant.parse("2025-01-06T18:00:00Z");

    private final CapacityEvaluator evaluator = new CapacityEvaluator();

    @Test
    void exclusive_anyOverlap_isConflict() {
        AvailabilityTimeline timeline = openAllDay(ReservationMode.EXCLUSIVE, 1);
        BookedInterval existing = booking(100L, "09:00", "10:00", ReservationMode.EXCLUSIVE);

        ResourceAvailabilityCheck check = evaluator.evaluate(timeline, at("09:30"), at("10:30"), List.of(existing));

        assertThat(check.available()).isFalse();
        assertThat(check.conflicts()).singleElement()
            .satisfies(c -> assertThat(c.appointmentId()).isEqualTo(100L));
        assertThat(check.reason()).contains("already reserved");
    }

    @Test
    void exclusive_touchingIntervals_doNotConflict() {
        AvailabilityTimeline timeline = openAllDay(ReservationMode.EXCLUSIVE, 1);
        BookedInterval existing = booking(100L, "09:00", "10:00", ReservationMode.EXCLUSIVE);

        ResourceAvailabilityCheck check = evaluator.evaluate(timeline, at("10:00"), at("11:00"), List.of(existing));

        assertThat(check.available()).isTrue();
        assertThat(check.mode()).isEqualTo(ReservationMode.EXCLUSIVE);
    }

    @Test
    void shared_belowCapacity_isAvailable() {
        AvailabilityTimeline timeline = openAllDay(ReservationMode.SHARED, 2);
        BookedInterval existing = booking(100L, "09:00", "10:00", ReservationMode.SHARED);

        ResourceAvailabilityCheck check = evaluator.evaluate(timeline, at("09:00"), at("10:00"), List.of(existing));

        assertThat(check.available()).isTrue();
        assertThat(check.capacity()).isEqualTo(2);
        assertThat(check.currentBookings()).isEqualTo(1);
    }

    @Test
    void shared_usesPeakOverlapNotTotalCount() {
        AvailabilityTimeline timeline = openAllDay(ReservationMode.SHARED, 2);
        // Two bookings inside the window that never overlap each other
        List<BookedInterval> bookings = List.of(
            booking(100L, "09:00", "09:30", ReservationMode.SHARED),
            booking(101L, "09:30", "10:00", ReservationMode.SHARED));

        ResourceAvailabilityCheck check = evaluator.evaluate(timeline, at("09:00"), at("10:00"), bookings);

        assertThat(check.available()).isTrue();
        assertThat(check.currentBookings()).isEqualTo(1);
    }

    @Test
    void shared_atCapacity_isConflict() {
        AvailabilityTimeline timeline = openAllDay(ReservationMode.SHARED, 2);
        List<BookedInterval> bookings = List.of(
            booking(100L, "09:00", "10:00", ReservationMode.SHARED),
            booking(101L, "09:15", "09:45", ReservationMode.SHARED));

        ResourceAvailabilityCheck check = evaluator.evaluate(timeline, at("09:00"), at("10:00"), bookings);

        assertThat(check.available()).isFalse();
        assertThat(check.conflicts()).hasSize(2);
        assertThat(check.reason()).contains("at capacity (2/2)");
    }

    @Test
    void shared_existingExclusiveReservation_blocks() {
        AvailabilityTimeline timeline = openAllDay(ReservationMode.SHARED, 5);
        BookedInterval existing = booking(100L, "09:00", "10:00", ReservationMode.EXCLUSIVE);

        ResourceAvailabilityCheck check = evaluator.evaluate(timeline, at("09:00"), at("10:00"), List.of(existing));

        assertThat(check.available()).isFalse();
        assertThat(check.conflicts()).extracting(c -> c.appointmentId()).containsExactly(100L);
    }

    @Test
    void blockedWindow_winsOverAvailability() {
        AvailabilityTimeline timeline = new AvailabilityTimeline(1L,
            List.of(new AvailabilityWindow(1L, DAY_START, DAY_END, AvailabilityType.AVAILABLE,
                ReservationMode.EXCLUSIVE, 1)),
            List.of(new AvailabilityWindow(1L, at("12:00"), at("13:00"), AvailabilityType.BLOCKED,
                ReservationMode.EXCLUSIVE, 1)));

        ResourceAvailabilityCheck check = evaluator.evaluate(timeline, at("12:30"), at("13:30"), List.of());

        assertThat(check.available()).isFalse();
        assertThat(check.reason()).contains("blocked");
    }

    @Test
    void windowOutsideAvailability_isUnavailable() {
        AvailabilityTimeline timeline = openAllDay(ReservationMode.EXCLUSIVE, 1);

        ResourceAvailabilityCheck check = evaluator.evaluate(timeline, at("17:30"), at("18:30"), List.of());

        assertThat(check.available()).isFalse();
        assertThat(check.reason()).contains("not available");
    }

    @Test
    void peakOverlap_clipsToWindow() {
        List<BookedInterval> bookings = List.of(
            booking(1L, "08:00", "09:00", ReservationMode.SHARED),
            booking(2L, "08:30", "12:00", ReservationMode.SHARED),
            booking(3L, "11:00", "11:30", ReservationMode.SHARED));

        assertThat(CapacityEvaluator.peakOverlap(bookings, at("08:00"), at("12:00"))).isEqualTo(2);
        assertThat(CapacityEvaluator.peakOverlap(bookings, at("09:00"), at("10:00"))).isEqualTo(1);
    }

    private static AvailabilityTimeline openAllDay(ReservationMode mode, int capacity) {
        return new AvailabilityTimeline(1L,
            List.of(new AvailabilityWindow(1L, DAY_START, DAY_END, AvailabilityType.AVAILABLE, mode, capacity)),
            List.of());
    }

    private static BookedInterval booking(Long appointmentId, String from, String to, ReservationMode mode) {
        return new BookedInterval(1L, appointmentId, at(from), at(to), mode);
    }

    private static Instant at(String time) {
        return Instant.parse("2025-01-06T" + time + ":00Z");
    }
}
