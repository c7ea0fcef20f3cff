package com.simqueue.db;

import com.simqueue.core.CreateJobInput;
import com.simqueue.core.JobConflictException;
import com.simqueue.core.JobFilter;
import com.simqueue.core.JobNotFoundException;
import com.simqueue.core.JobPage;
import com.simqueue.core.JobStatus;
import com.simqueue.core.JobValidationException;
import com.simqueue.core.SimulationJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryJobStoreTest {

    private InMemoryJobStore store;

    @BeforeEach
    public void setUp() {
        store = new InMemoryJobStore();
    }

    private SimulationJob enqueue(String serviceId, Integer priority) {
        return store.enqueue(new CreateJobInput(1L, serviceId, "{}", "{\"replicas\":3}").setPriority(priority));
    }

    @Test
    public void testClaimOrder() {
        enqueue("low", 10);
        enqueue("high", 90);
        enqueue("mid", 50);
        enqueue("mid-later", 50);

        assertEquals("high", store.claimNextReady().orElseThrow().getServiceId());
        assertEquals("mid", store.claimNextReady().orElseThrow().getServiceId());
        assertEquals("mid-later", store.claimNextReady().orElseThrow().getServiceId());
        assertEquals("low", store.claimNextReady().orElseThrow().getServiceId());
        assertTrue(store.claimNextReady().isEmpty());
    }

    @Test
    public void testReturnedJobsAreCopies() {
        SimulationJob job = enqueue("checkout", null);
        job.setStatus(JobStatus.COMPLETED);

        assertEquals(JobStatus.PENDING, store.getJob(job.getId()).orElseThrow().getStatus(),
            "Mutating a returned job must not change the store");
    }

    @Test
    public void testLifecycle() {
        long id = enqueue("checkout", null).getId();

        assertFalse(store.markCompleted(id, "{}"), "Pending job cannot complete");
        SimulationJob running = store.claimNextReady().orElseThrow();
        assertNotNull(running.getStartedAt());
        assertThrows(JobConflictException.class, () -> store.cancelJob(id));

        assertTrue(store.markCompleted(id, "{\"verdict\":\"approved\"}"));
        assertFalse(store.markFailed(id, "late"));

        SimulationJob done = store.getJob(id).orElseThrow();
        assertEquals(JobStatus.COMPLETED, done.getStatus());
        assertEquals("{\"verdict\":\"approved\"}", done.getResult());
        assertNull(done.getErrorMessage());
        assertNotNull(done.getCompletedAt());
    }

    @Test
    public void testCancel() {
        long id = enqueue("checkout", null).getId();

        assertEquals(JobStatus.CANCELLED, store.cancelJob(id).getStatus());
        assertThrows(JobConflictException.class, () -> store.cancelJob(id));
        assertThrows(JobNotFoundException.class, () -> store.cancelJob(99L));
        assertTrue(store.claimNextReady().isEmpty());
    }

    @Test
    public void testValidationRejectsWithoutStoring() {
        assertThrows(JobValidationException.class, () -> enqueue("checkout", -5));
        assertThrows(JobValidationException.class, () -> enqueue(null, null));

        assertEquals(0, store.listJobs(JobFilter.all(), 10, 0).getTotal());
    }

    @Test
    public void testListAndStats() {
        enqueue("a", 10);
        enqueue("b", 30);
        store.enqueue(new CreateJobInput(2L, "c", "{}", "{}"));
        store.claimNextReady();

        JobPage page = store.listJobs(JobFilter.forUser(1L), 1, 0);
        assertEquals(2, page.getTotal());
        assertEquals("b", page.getJobs().get(0).getServiceId());

        Map<JobStatus, Long> stats = store.getQueueStats();
        assertEquals(2L, stats.get(JobStatus.PENDING));
        assertEquals(1L, stats.get(JobStatus.RUNNING));
        assertEquals(0L, stats.get(JobStatus.CANCELLED));
    }
}
