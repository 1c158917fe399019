package com.clinic.scheduling.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record AdjustInventoryRequest(

    @NotNull(message = "Delta is required")
    Integer delta,

    @Size(max = 255, message = "Reason must not exceed 255 characters")
    String reason
) {}
