package com.clinic.scheduling.event;

import com.clinic.scheduling.entity.AppointmentStatus;

public record AppointmentStatusChangedEvent(
    String tenantId,
    Long appointmentId,
    AppointmentStatus from,
    AppointmentStatus to
) {}
