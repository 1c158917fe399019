package com.clinic.scheduling.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateRoleRequest(

    @NotBlank(message = "Code must not be blank")
    @Size(max = 50, message = "Code must not exceed 50 characters")
    String code,

    @NotBlank(message = "Name must not be blank")
    @Size(max = 100, message = "Name must not exceed 100 characters")
    String name,

    String description,

    @NotNull(message = "Resource type ID is required")
    Long resourceTypeId
) {}
