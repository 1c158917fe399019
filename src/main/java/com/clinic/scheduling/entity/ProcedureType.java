package com.clinic.scheduling.entity;

public enum ProcedureType {
    ATOMIC,
    COMPOSITE
}
