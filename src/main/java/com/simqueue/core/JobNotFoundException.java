package com.simqueue.core;

/**
 * Thrown when an operation targets a job id that does not exist.
 */
public class JobNotFoundException extends SimulationQueueException {

    private final long jobId;

    public JobNotFoundException(long jobId) {
        super("job not found: " + jobId);
        this.jobId = jobId;
    }

    public long getJobId() {
        return jobId;
    }
}
