package com.simqueue.core;

/**
 * Thrown when enqueue input (or a listing request) is malformed or incomplete.
 * The job is never created.
 */
public class JobValidationException extends SimulationQueueException {

    public JobValidationException(String message) {
        super(message);
    }

    public JobValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
