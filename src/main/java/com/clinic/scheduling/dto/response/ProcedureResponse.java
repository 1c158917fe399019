package com.clinic.scheduling.dto.response;

import com.clinic.scheduling.entity.ProcedureType;

import java.time.Instant;
import java.util.List;

public record ProcedureResponse(
    Long id,
    String tenantId,
    String code,
    String name,
    String description,
    ProcedureType procedureType,
    Integer durationMinutes,
    Integer bufferBeforeMinutes,
    Integer bufferAfterMinutes,
    int totalDurationMinutes,
    String color,
    boolean active,
    List<Child> children,
    List<RequirementResponse> requirements,
    Instant createdAt,
    Instant updatedAt
) {

    public record Child(
        Long compositionId,
        Long procedureId,
        String code,
        String name,
        Integer sequenceOrder,
        Integer gapAfterMinutes
    ) {}
}
