package com.clinic.scheduling.dto.request;

import com.clinic.scheduling.entity.ReservationMode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.Map;

/**
 * Full replacement of a resource's editable fields. Subtype and stock level are not
 * editable here; stock moves through inventory adjustments only.
 */
public record UpdateResourceRequest(

    @NotBlank(message = "Name must not be blank")
    @Size(max = 200, message = "Name must not exceed 200 characters")
    String name,

    String description,

    @NotNull(message = "Default reservation mode is required")
    ReservationMode defaultReservationMode,

    @NotNull(message = "Max concurrent bookings is required")
    @Min(value = 1, message = "Max concurrent bookings must be at least 1")
    Integer maxConcurrentBookings,

    Long parentResourceId,

    @PositiveOrZero(message = "Quantity threshold must not be negative")
    Integer quantityThreshold,

    @Size(max = 64, message = "Staff user ID must not exceed 64 characters")
    String staffUserId,

    Map<String, Object> metadata
) {}
