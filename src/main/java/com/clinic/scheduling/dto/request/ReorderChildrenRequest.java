package com.clinic.scheduling.dto.request;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/** Composition ids in their new order; must name every child of the procedure exactly once. */
public record ReorderChildrenRequest(

    @NotEmpty(message = "Composition IDs must not be empty")
    List<Long> compositionIds
) {}
