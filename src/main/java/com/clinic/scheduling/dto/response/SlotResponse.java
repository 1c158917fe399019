package com.clinic.scheduling.dto.response;

import com.clinic.scheduling.entity.SlotGenerationType;
import com.clinic.scheduling.entity.SlotStatus;

import java.time.Instant;

public record SlotResponse(
    Long id,
    String tenantId,
    Long procedureId,
    Instant startTime,
    Instant endTime,
    SlotStatus status,
    SlotGenerationType generationType,
    String notes,
    Instant completedAt
) {}
