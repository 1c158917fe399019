package com.clinic.scheduling.service.model;

import java.util.List;
import java.util.Map;

/**
 * Everything the resource selector reads, loaded once per generation or booking call.
 *
 * @param candidatesByRole role id to resources able to fill it, in catalog order
 * @param timelines        resource id to availability timeline covering every window asked for
 * @param bookings         resource id to live reservations overlapping those windows
 * @param preferences      appointment preferences, any order
 */
public record SelectionContext(
    Map<Long, List<RoleCandidate>> candidatesByRole,
    Map<Long, AvailabilityTimeline> timelines,
    Map<Long, List<BookedInterval>> bookings,
    List<PreferenceSpec> preferences
) {}
