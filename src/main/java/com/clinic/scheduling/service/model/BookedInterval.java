package com.clinic.scheduling.service.model;

import com.clinic.scheduling.entity.AppointmentResource;
import com.clinic.scheduling.entity.ReservationMode;

import java.time.Instant;

/**
 * A live reservation as seen by capacity checks. {@code appointmentId} is {@code null}
 * for tentative picks made earlier in the same resource combination.
 */
public record BookedInterval(
    Long resourceId,
    Long appointmentId,
    Instant start,
    Instant end,
    ReservationMode mode
) {

    public static BookedInterval of(AppointmentResource reservation) {
        return new BookedInterval(
            reservation.getResource().getId(),
            reservation.getAppointment().getId(),
            reservation.getReservedStart(),
            reservation.getReservedEnd(),
            reservation.getReservationMode());
    }

    public boolean overlaps(Instant otherStart, Instant otherEnd) {
        return start.isBefore(otherEnd) && end.isAfter(otherStart);
    }

    public ResourceConflict toConflict() {
        return new ResourceConflict(resourceId, appointmentId, start, end, mode);
    }
}
