package com.clinic.scheduling.dto.request;

import com.clinic.scheduling.entity.ProcedureType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.List;

public record CreateProcedureRequest(

    @NotBlank(message = "Code must not be blank")
    @Size(max = 50, message = "Code must not exceed 50 characters")
    String code,

    @NotBlank(message = "Name must not be blank")
    @Size(max = 200, message = "Name must not exceed 200 characters")
    String name,

    String description,

    @NotNull(message = "Procedure type is required")
    ProcedureType procedureType,

    @Positive(message = "Duration must be positive")
    Integer durationMinutes,

    @PositiveOrZero(message = "Buffer before must not be negative")
    Integer bufferBeforeMinutes,

    @PositiveOrZero(message = "Buffer after must not be negative")
    Integer bufferAfterMinutes,

    @Size(max = 20, message = "Color must not exceed 20 characters")
    String color,

    List<@Valid ProcedureChildRequest> children
) {}
