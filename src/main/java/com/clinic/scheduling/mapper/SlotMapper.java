package com.clinic.scheduling.mapper;

import com.clinic.scheduling.dto.response.SlotResponse;
import com.clinic.scheduling.entity.ProcedureSlot;

public final class SlotMapper {

    private SlotMapper() {}

    public static SlotResponse toResponse(ProcedureSlot slot) {
        return new SlotResponse(
            slot.getId(),
            slot.getTenantId(),
            slot.getProcedure().getId(),
            slot.getStartTime(),
            slot.getEndTime(),
            slot.getStatus(),
            slot.getGenerationType(),
            slot.getNotes(),
            slot.getCompletedAt()
        );
    }
}
