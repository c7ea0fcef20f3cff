package com.simqueue.core;

import java.sql.SQLException;
import java.util.Map;
import java.util.Optional;

/**
 * Durable table of simulation jobs.
 *
 * <p>The store owns every status transition. Workers only move jobs through
 * {@link #claimNextReady()}, {@link #markCompleted(long, String)} and
 * {@link #markFailed(long, String)}; the API only through {@link #enqueue(CreateJobInput)}
 * and {@link #cancelJob(long)}.</p>
 *
 * <p><b>Thread Safety:</b> implementations must be safe for any number of concurrent
 * callers. In particular N concurrent {@code claimNextReady()} calls each receive a
 * distinct job or none, without one caller waiting on another's in-flight claim.</p>
 *
 * <p>Every method reports persistence failures as {@link SQLException}; the job's
 * state is left unchanged in that case.</p>
 *
 * @see com.simqueue.db.JdbcJobStore
 * @see com.simqueue.db.InMemoryJobStore
 */
public interface JobStore {

    /**
     * Insert a new job in {@link JobStatus#PENDING} with {@code queuedAt = now}.
     *
     * @param input the job payload and scheduling attributes
     * @return the created job including its generated id
     * @throws JobValidationException if the input is incomplete or malformed; no job is created
     * @throws SQLException if the store is unavailable
     */
    SimulationJob enqueue(CreateJobInput input) throws SQLException;

    /**
     * Atomically pick the pending job with the highest priority (oldest {@code queuedAt}
     * first among equals) and move it to {@link JobStatus#RUNNING} with
     * {@code startedAt = now}.
     *
     * @return the claimed job, or empty when nothing is pending
     * @throws SQLException if the store is unavailable
     */
    Optional<SimulationJob> claimNextReady() throws SQLException;

    /**
     * Record a successful evaluation. Only applies to a job that is currently running.
     *
     * @param jobId the job id
     * @param result the evaluator response body
     * @return true if the job moved to COMPLETED, false if it was not running
     * @throws SQLException if the store is unavailable
     */
    boolean markCompleted(long jobId, String result) throws SQLException;

    /**
     * Record a failed evaluation. Only applies to a job that is currently running.
     *
     * @param jobId the job id
     * @param errorMessage diagnostic text stored with the job
     * @return true if the job moved to FAILED, false if it was not running
     * @throws SQLException if the store is unavailable
     */
    boolean markFailed(long jobId, String errorMessage) throws SQLException;

    /**
     * Cancel a job that no worker has claimed yet.
     *
     * @param jobId the job id
     * @return the cancelled job
     * @throws JobNotFoundException if no job has this id
     * @throws JobConflictException if the job is not pending
     * @throws SQLException if the store is unavailable
     */
    SimulationJob cancelJob(long jobId) throws SQLException;

    /**
     * @param jobId the job id
     * @return the job, or empty if no job has this id
     * @throws SQLException if the store is unavailable
     */
    Optional<SimulationJob> getJob(long jobId) throws SQLException;

    /**
     * List jobs ordered by priority (highest first), then queue time (oldest first).
     *
     * @param filter optional user and status criteria
     * @param limit page size, must be positive
     * @param offset number of matching jobs to skip, must not be negative
     * @return the page and the total number of matching jobs
     * @throws JobValidationException if limit or offset is out of range
     * @throws SQLException if the store is unavailable
     */
    JobPage listJobs(JobFilter filter, int limit, int offset) throws SQLException;

    /**
     * Count jobs per status. Every status is present; the counts sum to the number of
     * jobs in the store.
     *
     * @return counts keyed by status
     * @throws SQLException if the store is unavailable
     */
    Map<JobStatus, Long> getQueueStats() throws SQLException;

    static void checkPaging(int limit, int offset) {
        if (limit <= 0) {
            throw new JobValidationException("limit must be positive, got " + limit);
        }
        if (offset < 0) {
            throw new JobValidationException("offset must not be negative, got " + offset);
        }
    }
}
