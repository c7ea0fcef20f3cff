package com.simqueue.core;

/**
 * Thrown when a status transition is requested from a state that does not allow it,
 * e.g. cancelling a job that is already running or terminal.
 *
 * <p>The caller has to wait for a running job to reach a terminal state; a conflict is
 * never silently turned into success.</p>
 */
public class JobConflictException extends SimulationQueueException {

    private final long jobId;
    private final JobStatus currentStatus;
    private final JobStatus requestedStatus;

    public JobConflictException(long jobId, JobStatus currentStatus, JobStatus requestedStatus) {
        super("job " + jobId + " is " + currentStatus + ", cannot move to " + requestedStatus);
        this.jobId = jobId;
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
    }

    public long getJobId() {
        return jobId;
    }

    /**
     * @return the status the job was in when the transition was refused
     */
    public JobStatus getCurrentStatus() {
        return currentStatus;
    }

    public JobStatus getRequestedStatus() {
        return requestedStatus;
    }
}
