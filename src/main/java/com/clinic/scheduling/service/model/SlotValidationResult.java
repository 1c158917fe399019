package com.clinic.scheduling.service.model;

import java.util.List;

public record SlotValidationResult(
    Long slotId,
    boolean valid,
    List<String> issues,
    List<GeneratedSlot> alternatives
) {}
