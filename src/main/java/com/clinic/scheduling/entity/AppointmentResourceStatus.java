package com.clinic.scheduling.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status of a single resource reservation row. {@link #DECLINED} and {@link #RELEASED}
 * rows are kept as history and no longer count against capacity.
 */
public enum AppointmentResourceStatus {
    ASSIGNED,
    CONFIRMED,
    DECLINED,
    NEEDS_COVERAGE,
    RELEASED;

    public static final Set<AppointmentResourceStatus> NOT_LIVE = EnumSet.of(DECLINED, RELEASED);

    public boolean isLive() {
        return !NOT_LIVE.contains(this);
    }
}
