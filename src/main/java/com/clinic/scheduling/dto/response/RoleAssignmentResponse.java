package com.clinic.scheduling.dto.response;

public record RoleAssignmentResponse(
    Long id,
    Long resourceId,
    String resourceName,
    Long roleId,
    String roleCode,
    Integer priority
) {}
