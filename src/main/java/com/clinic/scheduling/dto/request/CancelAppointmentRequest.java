package com.clinic.scheduling.dto.request;

import jakarta.validation.constraints.Size;

public record CancelAppointmentRequest(

    @Size(max = 255, message = "Reason must not exceed 255 characters")
    String reason
) {}
