package com.clinic.scheduling.entity;

public enum MetadataFieldType {
    STRING,
    NUMBER,
    BOOLEAN
}
