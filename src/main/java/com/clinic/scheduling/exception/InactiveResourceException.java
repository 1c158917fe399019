package com.clinic.scheduling.exception;

public class InactiveResourceException extends RuntimeException {

    public InactiveResourceException(String entityName, Long id) {
        super(entityName + " " + id + " is deactivated");
    }
}
