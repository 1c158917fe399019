package com.clinic.scheduling.dto.request;

import jakarta.validation.constraints.NotNull;

public record ReassignResourceRequest(

    @NotNull(message = "Old resource ID is required")
    Long oldResourceId,

    @NotNull(message = "New resource ID is required")
    Long newResourceId
) {}
