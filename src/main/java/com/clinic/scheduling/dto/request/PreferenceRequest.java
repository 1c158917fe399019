package com.clinic.scheduling.dto.request;

import com.clinic.scheduling.entity.PreferenceType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record PreferenceRequest(

    @NotNull(message = "Role ID is required")
    Long roleId,

    @NotNull(message = "Resource ID is required")
    Long resourceId,

    @NotNull(message = "Preference type is required")
    PreferenceType preferenceType,

    @PositiveOrZero(message = "Priority must not be negative")
    Integer priority
) {}
