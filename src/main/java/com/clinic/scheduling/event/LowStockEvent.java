package com.clinic.scheduling.event;

/** A consumable's quantity dropped from above its threshold to at or below it. */
public record LowStockEvent(
    String tenantId,
    Long resourceId,
    String resourceName,
    int quantityOnHand,
    int quantityThreshold
) {}
