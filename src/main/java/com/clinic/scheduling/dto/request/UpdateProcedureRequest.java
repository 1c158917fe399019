package com.clinic.scheduling.dto.request;

import com.clinic.scheduling.entity.ProcedureType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/** {@code procedureType}, when sent, must match the stored type. */
public record UpdateProcedureRequest(

    @NotBlank(message = "Code must not be blank")
    @Size(max = 50, message = "Code must not exceed 50 characters")
    String code,

    @NotBlank(message = "Name must not be blank")
    @Size(max = 200, message = "Name must not exceed 200 characters")
    String name,

    String description,

    ProcedureType procedureType,

    @Positive(message = "Duration must be positive")
    Integer durationMinutes,

    @PositiveOrZero(message = "Buffer before must not be negative")
    Integer bufferBeforeMinutes,

    @PositiveOrZero(message = "Buffer after must not be negative")
    Integer bufferAfterMinutes,

    @Size(max = 20, message = "Color must not exceed 20 characters")
    String color
) {}
