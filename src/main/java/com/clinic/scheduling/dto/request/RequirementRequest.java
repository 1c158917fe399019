package com.clinic.scheduling.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * A role requirement. Offsets are minutes from the start of the procedure's active part;
 * a {@code null} end offset means "until the end of the procedure".
 */
public record RequirementRequest(

    @NotNull(message = "Role ID is required")
    Long roleId,

    @Min(value = 1, message = "Quantity min must be at least 1")
    Integer quantityMin,

    @Min(value = 1, message = "Quantity max must be at least 1")
    Integer quantityMax,

    Boolean required,

    @PositiveOrZero(message = "Offset start must not be negative")
    Integer offsetStartMinutes,

    @PositiveOrZero(message = "Offset end must not be negative")
    Integer offsetEndMinutes,

    String notes
) {}
