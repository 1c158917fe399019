package com.clinic.scheduling.service.model;

import com.clinic.scheduling.entity.PreferenceType;

/** A role to resource preference considered while picking resources. */
public record PreferenceSpec(Long roleId, Long resourceId, PreferenceType type, int priority) {}
