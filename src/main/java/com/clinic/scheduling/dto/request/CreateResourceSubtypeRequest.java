package com.clinic.scheduling.dto.request;

import com.clinic.scheduling.entity.MetadataField;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public record CreateResourceSubtypeRequest(

    @NotNull(message = "Resource type ID is required")
    Long resourceTypeId,

    @NotBlank(message = "Code must not be blank")
    @Size(max = 50, message = "Code must not exceed 50 characters")
    String code,

    @NotBlank(message = "Name must not be blank")
    @Size(max = 100, message = "Name must not exceed 100 characters")
    String name,

    String description,

    @Valid
    List<MetadataField> metadataSchema
) {}
