package com.clinic.scheduling.event;

public record RoleAssignmentChangedEvent(
    String tenantId,
    Long resourceId,
    Long roleId,
    Change change,
    Integer priority
) {

    public enum Change {
        ASSIGNED,
        UPDATED,
        UNASSIGNED
    }
}
