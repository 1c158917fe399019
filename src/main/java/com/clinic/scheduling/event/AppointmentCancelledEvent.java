package com.clinic.scheduling.event;

import java.time.Instant;

public record AppointmentCancelledEvent(
    String tenantId,
    Long appointmentId,
    Long slotId,
    String contactId,
    String reason,
    Instant cancelledAt
) {}
