package com.clinic.scheduling.service.model;

/**
 * A role requirement of an atomic procedure placed inside the slot of the procedure tree
 * that contains it. Offsets are minutes from the slot start; {@code endOffsetMinutes} is
 * exclusive.
 */
public record ExpandedRequirement(
    Long procedureId,
    Long requirementId,
    Long roleId,
    int quantityMin,
    Integer quantityMax,
    boolean required,
    int startOffsetMinutes,
    int endOffsetMinutes
) {}
