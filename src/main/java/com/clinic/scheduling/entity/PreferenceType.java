package com.clinic.scheduling.entity;

public enum PreferenceType {
    PREFERRED,
    REQUIRED
}
