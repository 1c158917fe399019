package com.clinic.scheduling.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record AssignRoleRequest(

    @NotNull(message = "Role ID is required")
    Long roleId,

    @PositiveOrZero(message = "Priority must not be negative")
    Integer priority
) {}
