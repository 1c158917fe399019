package com.clinic.scheduling.event;

import java.time.Instant;

public record AppointmentCompletedEvent(
    String tenantId,
    Long appointmentId,
    Long slotId,
    String contactId,
    Instant completedAt
) {}
