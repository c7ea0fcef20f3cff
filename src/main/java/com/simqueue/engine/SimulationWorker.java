package com.simqueue.engine;

import com.simqueue.core.JobStore;
import com.simqueue.core.SimulationJob;
import com.simqueue.delegate.DelegateCallException;
import com.simqueue.delegate.EvaluationRequest;
import com.simqueue.delegate.ExecutionDelegate;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Polling consumer of the simulation queue.
 *
 * <p>Every poll interval the worker runs one cycle: claim the next ready job, hand it to
 * the {@link ExecutionDelegate}, and write the outcome back to the {@link JobStore}. One
 * job per tick, cycles never overlap, and a failed evaluation is final: there is no
 * retry and no way back to PENDING.</p>
 *
 * <p><b>Lifecycle:</b> each instance owns its own running flag and stop signal, so several
 * workers can share one store (the store's claim keeps them on distinct jobs).
 * {@link #stop()} is cooperative: it is observed between ticks and never interrupts a job
 * already handed to the delegate.</p>
 *
 * <pre>{@code
 * SimulationWorker worker = new SimulationWorker("worker-1", store, delegate, Duration.ofSeconds(5));
 * Thread thread = new Thread(worker, "worker-1");
 * thread.start();
 * ...
 * worker.stop();
 * worker.awaitTermination(Duration.ofMinutes(6));
 * }</pre>
 *
 * @see JobStore#claimNextReady()
 */
public class SimulationWorker implements Runnable {
    private static final Logger logger = Logger.getLogger(SimulationWorker.class.getName());

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(5);

    private final String name;
    private final JobStore store;
    private final ExecutionDelegate delegate;
    private final Duration pollInterval;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch terminated = new CountDownLatch(1);

    public SimulationWorker(String name, JobStore store, ExecutionDelegate delegate, Duration pollInterval) {
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("poll interval must be positive: " + pollInterval);
        }
        this.name = name;
        this.store = store;
        this.delegate = delegate;
        this.pollInterval = pollInterval;
    }

    public SimulationWorker(JobStore store, ExecutionDelegate delegate) {
        this("simulation-worker", store, delegate, DEFAULT_POLL_INTERVAL);
    }

    /**
     * Run the polling loop until {@link #stop()} is called or the thread is interrupted.
     * Blocks the calling thread.
     */
    @Override
    public void run() {
        if (stopRequested.get()) {
            logger.warning(name + " was stopped before it started");
            terminated.countDown();
            return;
        }
        if (!running.compareAndSet(false, true)) {
            logger.warning(name + " is already running");
            return;
        }

        logger.info(name + " started (poll interval " + pollInterval.toMillis() + "ms)");

        try {
            while (!stopRequested.get()) {
                if (stopSignal.await(pollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
                try {
                    processNextJob();
                } catch (RuntimeException e) {
                    logger.log(Level.SEVERE, name + ": unexpected error in worker cycle", e);
                }
            }
        } catch (InterruptedException e) {
            logger.info(name + " interrupted, stopping");
            Thread.currentThread().interrupt();
        } finally {
            running.set(false);
            terminated.countDown();
            logger.info(name + " stopped");
        }
    }

    /**
     * Run one claim-and-execute cycle.
     *
     * @return true if a job was claimed (whatever its outcome), false if the queue was
     *         empty or the claim itself failed
     */
    public boolean processNextJob() {
        Optional<SimulationJob> claimed;
        try {
            claimed = store.claimNextReady();
        } catch (SQLException e) {
            logger.log(Level.SEVERE, name + ": failed to get next job", e);
            return false;
        }

        if (claimed.isEmpty()) {
            return false;
        }

        SimulationJob job = claimed.get();
        logger.info(name + " processing simulation job " + job.getId() + " (service " + job.getServiceId()
            + ", user " + job.getUserId() + ")");

        String result;
        try {
            result = delegate.evaluate(EvaluationRequest.fromJob(job));
        } catch (DelegateCallException e) {
            logger.warning(name + ": simulation job " + job.getId() + " failed: " + e.getMessage());
            recordFailure(job.getId(), e.getMessage());
            return true;
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, name + ": simulation job " + job.getId() + " failed unexpectedly", e);
            recordFailure(job.getId(), e.getClass().getSimpleName() + ": " + e.getMessage());
            return true;
        }

        try {
            store.markCompleted(job.getId(), result);
            logger.info(name + ": simulation job " + job.getId() + " completed");
        } catch (SQLException e) {
            logger.log(Level.SEVERE, name + ": failed to store result of simulation job " + job.getId(), e);
            recordFailure(job.getId(), "mark completed: " + e.getMessage());
        }
        return true;
    }

    private void recordFailure(long jobId, String errorMessage) {
        try {
            store.markFailed(jobId, errorMessage);
        } catch (SQLException e) {
            // job stays RUNNING; nothing reclaims it
            logger.log(Level.SEVERE, name + ": failed to mark simulation job " + jobId + " as failed", e);
        }
    }

    /**
     * Ask the loop to exit after the current cycle. Returns immediately.
     */
    public void stop() {
        if (stopRequested.compareAndSet(false, true)) {
            logger.info("Stop requested for " + name);
            stopSignal.countDown();
        }
    }

    /**
     * Wait for the loop to exit after {@link #stop()}.
     *
     * @param timeout maximum time to wait
     * @return true if the loop exited in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isRunning() {
        return running.get();
    }

    public String getName() {
        return name;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }
}
