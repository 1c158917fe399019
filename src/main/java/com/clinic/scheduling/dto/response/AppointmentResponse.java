package com.clinic.scheduling.dto.response;

import com.clinic.scheduling.entity.AppointmentResourceStatus;
import com.clinic.scheduling.entity.AppointmentStatus;
import com.clinic.scheduling.entity.PreferenceType;
import com.clinic.scheduling.entity.ReservationMode;

import java.time.Instant;
import java.util.List;

public record AppointmentResponse(
    Long id,
    String tenantId,
    Long slotId,
    Long procedureId,
    Instant startTime,
    Instant endTime,
    String contactId,
    AppointmentStatus status,
    String notes,
    String cancellationReason,
    Instant cancelledAt,
    Instant completedAt,
    String createdBy,
    List<Reservation> resources,
    List<Preference> preferences,
    Instant createdAt
) {

    public record Reservation(
        Long id,
        Long resourceId,
        Long roleId,
        Instant reservedStart,
        Instant reservedEnd,
        ReservationMode reservationMode,
        AppointmentResourceStatus status,
        Integer quantityConsumed
    ) {}

    public record Preference(
        Long roleId,
        Long resourceId,
        PreferenceType preferenceType,
        Integer priority
    ) {}
}
