package com.clinic.scheduling.service.model;

import java.util.List;

/**
 * Resource combination picked for one slot window, or why none could be picked.
 */
public record SelectionResult(
    List<ResourceAssignment> assignments,
    int score,
    Failure failure
) {

    public static SelectionResult success(List<ResourceAssignment> assignments, int score) {
        return new SelectionResult(List.copyOf(assignments), score, null);
    }

    public static SelectionResult failed(String message, List<ResourceConflict> conflicts) {
        return new SelectionResult(List.of(), 0, new Failure(message, List.copyOf(conflicts), null));
    }

    public static SelectionResult outOfStock(String message, StockShortfall shortfall) {
        return new SelectionResult(List.of(), 0, new Failure(message, List.of(), shortfall));
    }

    public boolean successful() {
        return failure == null;
    }

    /** {@code shortfall} is set when the only obstacle was consumable stock. */
    public record Failure(String message, List<ResourceConflict> conflicts, StockShortfall shortfall) {}

    public record StockShortfall(Long resourceId, int onHand, int requested) {}
}
