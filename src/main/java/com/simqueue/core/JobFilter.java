package com.simqueue.core;

/**
 * Optional criteria for {@link JobStore#listJobs(JobFilter, int, int)}.
 * A {@code null} field matches every job.
 */
public final class JobFilter {
    private static final JobFilter ALL = new JobFilter(null, null);

    private final Long userId;
    private final JobStatus status;

    private JobFilter(Long userId, JobStatus status) {
        this.userId = userId;
        this.status = status;
    }

    public static JobFilter all() {
        return ALL;
    }

    public static JobFilter of(Long userId, JobStatus status) {
        return new JobFilter(userId, status);
    }

    public static JobFilter forUser(long userId) {
        return new JobFilter(userId, null);
    }

    public Long getUserId() {
        return userId;
    }

    public JobStatus getStatus() {
        return status;
    }

    public boolean matches(SimulationJob job) {
        return (userId == null || userId == job.getUserId())
            && (status == null || status == job.getStatus());
    }

    @Override
    public String toString() {
        return "JobFilter{userId=" + userId + ", status=" + status + "}";
    }
}
