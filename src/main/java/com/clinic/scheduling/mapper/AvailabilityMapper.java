package com.clinic.scheduling.mapper;

import com.clinic.scheduling.dto.response.AvailabilityResponse;
import com.clinic.scheduling.entity.ResourceAvailability;

public final class AvailabilityMapper {

    private AvailabilityMapper() {}

    public static AvailabilityResponse toResponse(ResourceAvailability availability) {
        return new AvailabilityResponse(
            availability.getId(),
            availability.getResource().getId(),
            availability.getStartTime(),
            availability.getEndTime(),
            availability.getAvailabilityType(),
            availability.getRecurrencePattern(),
            availability.getReservationModeOverride(),
            availability.getMaxConcurrentOverride(),
            availability.getReason(),
            availability.getCreatedBy()
        );
    }
}
