package com.clinic.scheduling.entity;

/**
 * One field declared by a {@link ResourceSubtype}'s metadata schema.
 */
public record MetadataField(String name, MetadataFieldType type, boolean required) {}
