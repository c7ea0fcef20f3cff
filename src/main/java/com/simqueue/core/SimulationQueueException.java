package com.simqueue.core;

/**
 * Base class for the queue's caller-facing errors.
 *
 * <p>Persistence failures are not part of this hierarchy: every {@link JobStore}
 * operation reports them as {@link java.sql.SQLException}.</p>
 *
 * @see JobValidationException
 * @see JobNotFoundException
 * @see JobConflictException
 */
public abstract class SimulationQueueException extends RuntimeException {

    protected SimulationQueueException(String message) {
        super(message);
    }

    protected SimulationQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
