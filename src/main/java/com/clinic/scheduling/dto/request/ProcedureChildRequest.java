package com.clinic.scheduling.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Adds a child procedure to a composite. Without {@code sequenceOrder} the child is
 * appended; otherwise it is inserted at that zero-based position.
 */
public record ProcedureChildRequest(

    @NotNull(message = "Child procedure ID is required")
    Long childProcedureId,

    @PositiveOrZero(message = "Sequence order must not be negative")
    Integer sequenceOrder,

    @PositiveOrZero(message = "Gap after must not be negative")
    Integer gapAfterMinutes
) {}
