package com.clinic.scheduling.dto.response;

import com.clinic.scheduling.entity.ReservationMode;

import java.time.Instant;
import java.util.Map;

public record ResourceResponse(
    Long id,
    String tenantId,
    Long subtypeId,
    String subtypeCode,
    String resourceTypeCode,
    String name,
    String description,
    ReservationMode defaultReservationMode,
    Integer maxConcurrentBookings,
    Long parentResourceId,
    boolean consumable,
    Integer quantityOnHand,
    Integer quantityThreshold,
    boolean lowStock,
    String staffUserId,
    Map<String, Object> metadata,
    boolean active,
    Instant createdAt,
    Instant updatedAt
) {}
