package com.clinic.scheduling.service.model;

import java.time.Instant;
import java.util.List;

/**
 * Live appointments holding a resource in a window, each with the resources that could
 * take over its reservation.
 */
public record CoverageReport(
    Long resourceId,
    Instant from,
    Instant to,
    List<AffectedAppointment> appointments
) {

    public record AffectedAppointment(
        Long appointmentId,
        Long roleId,
        Instant reservedStart,
        Instant reservedEnd,
        List<Long> alternativeResourceIds
    ) {}
}
