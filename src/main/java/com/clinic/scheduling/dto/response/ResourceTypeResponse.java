package com.clinic.scheduling.dto.response;

public record ResourceTypeResponse(
    Long id,
    String code,
    String name,
    String description,
    Integer sortOrder,
    boolean active
) {}
