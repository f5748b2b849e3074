package com.publishpipe.publisher.model;

/**
 * Thrown by {@link WorkUnit#create} when the new unit could not be registered
 * with its plugin or its item. Any registration already made has been undone.
 */
public class WorkUnitRegistrationException extends RuntimeException {

    public WorkUnitRegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
