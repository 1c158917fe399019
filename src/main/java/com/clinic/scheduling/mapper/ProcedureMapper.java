package com.clinic.scheduling.mapper;

import com.clinic.scheduling.dto.response.ProcedureResponse;
import com.clinic.scheduling.dto.response.RequirementResponse;
import com.clinic.scheduling.entity.Procedure;
import com.clinic.scheduling.entity.ProcedureComposition;
import com.clinic.scheduling.entity.ProcedureRequirement;

public final class ProcedureMapper {

    private ProcedureMapper() {}

    public static ProcedureResponse toResponse(Procedure procedure, int totalDurationMinutes) {
        return new ProcedureResponse(
            procedure.getId(),
            procedure.getTenantId(),
            procedure.getCode(),
            procedure.getName(),
            procedure.getDescription(),
            procedure.getProcedureType(),
            procedure.getDurationMinutes(),
            procedure.getBufferBeforeMinutes(),
            procedure.getBufferAfterMinutes(),
            totalDurationMinutes,
            procedure.getColor(),
            procedure.isActive(),
            procedure.getChildren().stream().map(ProcedureMapper::toChild).toList(),
            procedure.getRequirements().stream().map(ProcedureMapper::toResponse).toList(),
            procedure.getCreatedAt(),
            procedure.getUpdatedAt()
        );
    }

    public static RequirementResponse toResponse(ProcedureRequirement requirement) {
        return new RequirementResponse(
            requirement.getId(),
            requirement.getProcedure().getId(),
            requirement.getRole().getId(),
            requirement.getRole().getCode(),
            requirement.getQuantityMin(),
            requirement.getQuantityMax(),
            requirement.isRequired(),
            requirement.getOffsetStartMinutes(),
            requirement.getOffsetEndMinutes(),
            requirement.getNotes()
        );
    }

    private static ProcedureResponse.Child toChild(ProcedureComposition composition) {
        return new ProcedureResponse.Child(
            composition.getId(),
            composition.getChild().getId(),
            composition.getChild().getCode(),
            composition.getChild().getName(),
            composition.getSequenceOrder(),
            composition.getGapAfterMinutes()
        );
    }
}
