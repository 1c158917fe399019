package com.clinic.scheduling.dto.response;

import com.clinic.scheduling.entity.MetadataField;

import java.util.List;

public record ResourceSubtypeResponse(
    Long id,
    Long resourceTypeId,
    String resourceTypeCode,
    String code,
    String name,
    String description,
    List<MetadataField> metadataSchema,
    boolean active
) {}
