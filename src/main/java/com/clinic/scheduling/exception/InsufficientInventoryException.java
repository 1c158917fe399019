package com.clinic.scheduling.exception;

public class InsufficientInventoryException extends RuntimeException {

    public InsufficientInventoryException(Long resourceId, int onHand, int requested) {
        super("Resource " + resourceId + " has " + onHand + " units on hand, cannot consume " + requested);
    }
}
