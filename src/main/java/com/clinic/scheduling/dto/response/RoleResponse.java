package com.clinic.scheduling.dto.response;

public record RoleResponse(
    Long id,
    String code,
    String name,
    String description,
    Long resourceTypeId,
    String resourceTypeCode,
    boolean active
) {}
