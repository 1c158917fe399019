package com.clinic.scheduling.event;

public record InventoryAdjustedEvent(
    String tenantId,
    Long resourceId,
    int delta,
    int quantityBefore,
    int quantityAfter,
    String reason
) {}
