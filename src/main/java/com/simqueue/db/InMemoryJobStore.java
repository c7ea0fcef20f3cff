package com.simqueue.db;

import com.simqueue.core.CreateJobInput;
import com.simqueue.core.JobConflictException;
import com.simqueue.core.JobFilter;
import com.simqueue.core.JobNotFoundException;
import com.simqueue.core.JobPage;
import com.simqueue.core.JobStatus;
import com.simqueue.core.JobStore;
import com.simqueue.core.SimulationJob;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Process-local {@link JobStore}. Every operation runs under the store's monitor, which
 * makes selection and transition in {@link #claimNextReady()} a single atomic step.
 * Nothing survives a restart.
 */
public class InMemoryJobStore implements JobStore {
    private static final Logger logger = Logger.getLogger(InMemoryJobStore.class.getName());

    static final Comparator<SimulationJob> QUEUE_ORDER = Comparator
        .comparingInt(SimulationJob::getPriority).reversed()
        .thenComparing(SimulationJob::getQueuedAt)
        .thenComparingLong(SimulationJob::getId);

    private final Map<Long, SimulationJob> jobs = new LinkedHashMap<>();
    private long nextId = 1;

    @Override
    public synchronized SimulationJob enqueue(CreateJobInput input) {
        int priority = input.validate();
        LocalDateTime now = LocalDateTime.now();

        SimulationJob job = new SimulationJob();
        job.setId(nextId++);
        job.setUserId(input.getUserId());
        job.setServiceId(input.getServiceId());
        job.setLlmProvider(input.getLlmProvider());
        job.setPromptVersionId(input.getPromptVersionId());
        job.setCurrentConfig(input.getCurrentConfig());
        job.setProposedConfig(input.getProposedConfig());
        job.setContext(input.getContext());
        job.setOptions(input.getOptions());
        job.setStatus(JobStatus.PENDING);
        job.setPriority(priority);
        job.setQueuedAt(now);
        job.setCreatedAt(now);

        jobs.put(job.getId(), job);
        logger.info("Enqueued simulation job " + job.getId() + " for service " + job.getServiceId());
        return job.copy();
    }

    @Override
    public synchronized Optional<SimulationJob> claimNextReady() {
        Optional<SimulationJob> next = jobs.values().stream()
            .filter(job -> job.getStatus() == JobStatus.PENDING)
            .min(QUEUE_ORDER);

        next.ifPresent(job -> {
            LocalDateTime now = LocalDateTime.now();
            transition(job, JobStatus.RUNNING, now);
            job.setStartedAt(now);
            logger.info("Claimed simulation job " + job.getId());
        });
        return next.map(SimulationJob::copy);
    }

    @Override
    public synchronized boolean markCompleted(long jobId, String result) {
        SimulationJob job = jobs.get(jobId);
        if (job == null || !job.getStatus().canTransitionTo(JobStatus.COMPLETED)) {
            logger.warning("Simulation job " + jobId + " not marked completed: job is not running");
            return false;
        }
        LocalDateTime now = LocalDateTime.now();
        transition(job, JobStatus.COMPLETED, now);
        job.setResult(result);
        job.setCompletedAt(now);
        return true;
    }

    @Override
    public synchronized boolean markFailed(long jobId, String errorMessage) {
        SimulationJob job = jobs.get(jobId);
        if (job == null || !job.getStatus().canTransitionTo(JobStatus.FAILED)) {
            logger.warning("Simulation job " + jobId + " not marked failed: job is not running");
            return false;
        }
        LocalDateTime now = LocalDateTime.now();
        transition(job, JobStatus.FAILED, now);
        job.setErrorMessage(errorMessage);
        job.setCompletedAt(now);
        return true;
    }

    @Override
    public synchronized SimulationJob cancelJob(long jobId) {
        SimulationJob job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        if (job.getStatus() != JobStatus.PENDING) {
            throw new JobConflictException(jobId, job.getStatus(), JobStatus.CANCELLED);
        }
        LocalDateTime now = LocalDateTime.now();
        transition(job, JobStatus.CANCELLED, now);
        job.setCompletedAt(now);
        logger.info("Cancelled simulation job " + jobId);
        return job.copy();
    }

    @Override
    public synchronized Optional<SimulationJob> getJob(long jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(SimulationJob::copy);
    }

    @Override
    public synchronized JobPage listJobs(JobFilter filter, int limit, int offset) {
        JobStore.checkPaging(limit, offset);

        List<SimulationJob> matching = jobs.values().stream()
            .filter(filter::matches)
            .sorted(QUEUE_ORDER)
            .collect(Collectors.toList());

        List<SimulationJob> page = matching.stream()
            .skip(offset)
            .limit(limit)
            .map(SimulationJob::copy)
            .collect(Collectors.toList());

        return new JobPage(page, matching.size());
    }

    @Override
    public synchronized Map<JobStatus, Long> getQueueStats() {
        Map<JobStatus, Long> stats = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            stats.put(status, 0L);
        }
        for (SimulationJob job : jobs.values()) {
            stats.merge(job.getStatus(), 1L, Long::sum);
        }
        return stats;
    }

    private static void transition(SimulationJob job, JobStatus target, LocalDateTime now) {
        if (!job.getStatus().canTransitionTo(target)) {
            throw new JobConflictException(job.getId(), job.getStatus(), target);
        }
        job.setStatus(target);
        job.setUpdatedAt(now);
    }
}
