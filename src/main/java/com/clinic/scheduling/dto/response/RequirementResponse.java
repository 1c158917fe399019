package com.clinic.scheduling.dto.response;

public record RequirementResponse(
    Long id,
    Long procedureId,
    Long roleId,
    String roleCode,
    Integer quantityMin,
    Integer quantityMax,
    boolean required,
    Integer offsetStartMinutes,
    Integer offsetEndMinutes,
    String notes
) {}
