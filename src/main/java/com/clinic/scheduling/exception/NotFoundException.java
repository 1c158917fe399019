package com.clinic.scheduling.exception;

public class NotFoundException extends RuntimeException {

    public NotFoundException(String entityName, Object id) {
        super(entityName + " not found with id " + id);
    }
}
