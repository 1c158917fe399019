package com.clinic.scheduling.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.List;

/** Books either an existing slot ({@code slotId}) or a new window starting at {@code startTime}. */
public record CreateAppointmentRequest(

    @NotNull(message = "Procedure ID is required")
    Long procedureId,

    Long slotId,

    Instant startTime,

    @Size(max = 64, message = "Contact ID must not exceed 64 characters")
    String contactId,

    List<@Valid PreferenceRequest> preferences,

    String notes,

    @Size(max = 64, message = "Created by must not exceed 64 characters")
    String createdBy
) {}
