package com.clinic.scheduling.service.model;

import com.clinic.scheduling.entity.ReservationMode;

import java.util.List;

/**
 * Outcome of evaluating one resource for one window.
 *
 * @param currentBookings peak number of live reservations overlapping the window
 * @param reason          why the resource cannot take the booking, {@code null} when available
 */
public record ResourceAvailabilityCheck(
    Long resourceId,
    boolean available,
    ReservationMode mode,
    int capacity,
    int currentBookings,
    List<ResourceConflict> conflicts,
    String reason
) {

    public static ResourceAvailabilityCheck unavailable(Long resourceId, String reason) {
        return new ResourceAvailabilityCheck(resourceId, false, null, 0, 0, List.of(), reason);
    }
}
