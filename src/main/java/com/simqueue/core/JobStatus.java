package com.simqueue.core;

/**
 * Lifecycle states of a simulation job.
 *
 * <p>State Transitions:</p>
 * <ul>
 *   <li>PENDING → RUNNING: job claimed by a worker</li>
 *   <li>PENDING → CANCELLED: job cancelled before any worker claimed it</li>
 *   <li>RUNNING → COMPLETED: evaluator returned a result</li>
 *   <li>RUNNING → FAILED: evaluator call failed or timed out</li>
 * </ul>
 *
 * <p>A running job cannot be cancelled and never returns to PENDING.</p>
 *
 * @see #canTransitionTo(JobStatus)
 */
public enum JobStatus {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    /**
     * Get the lower-case form used in the database and on the wire.
     *
     * @return the stored value (e.g. "pending")
     */
    public String getValue() {
        return value;
    }

    /**
     * Check if this status represents a terminal state.
     * No field of a job in a terminal state may change again.
     *
     * @return true for COMPLETED, FAILED and CANCELLED
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Validate if a transition to a new status is legal.
     *
     * @param newStatus the target status
     * @return true if the transition is allowed
     */
    public boolean canTransitionTo(JobStatus newStatus) {
        if (this.isTerminal()) {
            return false;
        }

        return switch (this) {
            case PENDING -> newStatus == RUNNING || newStatus == CANCELLED;
            case RUNNING -> newStatus == COMPLETED || newStatus == FAILED;
            default -> false;
        };
    }

    /**
     * Resolve a stored or wire value. Matching ignores case.
     *
     * @param value the status text (e.g. "running")
     * @return the matching status
     * @throws JobValidationException if the value names no status
     */
    public static JobStatus fromValue(String value) {
        if (value != null) {
            for (JobStatus status : values()) {
                if (status.value.equalsIgnoreCase(value.trim())) {
                    return status;
                }
            }
        }
        throw new JobValidationException("unknown job status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
