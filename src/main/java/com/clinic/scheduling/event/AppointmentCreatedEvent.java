package com.clinic.scheduling.event;

import java.time.Instant;
import java.util.List;

public record AppointmentCreatedEvent(
    String tenantId,
    Long appointmentId,
    Long slotId,
    Long procedureId,
    String contactId,
    Instant startTime,
    Instant endTime,
    List<Long> resourceIds
) {}
