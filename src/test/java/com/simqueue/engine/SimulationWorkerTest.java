package com.simqueue.engine;

import com.simqueue.core.CreateJobInput;
import com.simqueue.core.JobFilter;
import com.simqueue.core.JobPage;
import com.simqueue.core.JobStatus;
import com.simqueue.core.JobStore;
import com.simqueue.core.SimulationJob;
import com.simqueue.db.Database;
import com.simqueue.db.InMemoryJobStore;
import com.simqueue.db.JdbcJobStore;
import com.simqueue.delegate.DelegateCallException;
import com.simqueue.delegate.ExecutionDelegate;
import com.simqueue.delegate.HttpExecutionDelegate;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.*;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the polling worker: outcomes recorded per job, graceful stop and
 * several workers sharing one store.
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
public class SimulationWorkerTest {

    private static final Duration FAST_POLL = Duration.ofMillis(20);

    private InMemoryJobStore store;

    @BeforeEach
    public void setUp() {
        store = new InMemoryJobStore();
    }

    private long enqueue(String serviceId) throws SQLException {
        return store.enqueue(new CreateJobInput(1L, serviceId, "{\"replicas\":2}", "{\"replicas\":4}")).getId();
    }

    /**
     * Test 1: a successful evaluation completes the job with the response as result.
     */
    @Test
    @Order(1)
    public void testSuccessfulEvaluationCompletesJob() throws Exception {
        long id = enqueue("checkout");
        SimulationWorker worker = new SimulationWorker(store, request -> "{\"verdict\":\"approved\"}");

        assertTrue(worker.processNextJob(), "A job should have been processed");

        SimulationJob job = store.getJob(id).orElseThrow();
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals("{\"verdict\":\"approved\"}", job.getResult());
        assertNull(job.getErrorMessage());
        assertNotNull(job.getStartedAt());
        assertNotNull(job.getCompletedAt());
    }

    /**
     * Test 2: a delegate error fails the job with the error text.
     */
    @Test
    @Order(2)
    public void testDelegateErrorFailsJob() throws Exception {
        long id = enqueue("checkout");
        SimulationWorker worker = new SimulationWorker(store, request -> {
            throw new DelegateCallException(500, "internal error");
        });

        worker.processNextJob();

        SimulationJob job = store.getJob(id).orElseThrow();
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertEquals("advisor returned 500: internal error", job.getErrorMessage());
        assertNull(job.getResult());
    }

    /**
     * Test 3: an unexpected runtime error from the delegate still fails the job.
     */
    @Test
    @Order(3)
    public void testUnexpectedDelegateErrorFailsJob() throws Exception {
        long id = enqueue("checkout");
        SimulationWorker worker = new SimulationWorker(store, request -> {
            throw new IllegalStateException("no evaluator configured");
        });

        worker.processNextJob();

        SimulationJob job = store.getJob(id).orElseThrow();
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertEquals("IllegalStateException: no evaluator configured", job.getErrorMessage());
    }

    /**
     * Test 4: if the result cannot be stored the job is failed instead.
     */
    @Test
    @Order(4)
    public void testResultWriteFailureFailsJob() throws Exception {
        long id = enqueue("checkout");
        JobStore flaky = new ResultWriteFailingStore(store);
        SimulationWorker worker = new SimulationWorker(flaky, request -> "{\"verdict\":\"approved\"}");

        worker.processNextJob();

        SimulationJob job = store.getJob(id).orElseThrow();
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertEquals("mark completed: disk full", job.getErrorMessage());
    }

    /**
     * Test 5: an empty queue does not call the delegate.
     */
    @Test
    @Order(5)
    public void testEmptyQueue() {
        AtomicInteger calls = new AtomicInteger();
        SimulationWorker worker = new SimulationWorker(store, request -> {
            calls.incrementAndGet();
            return "{}";
        });

        assertFalse(worker.processNextJob());
        assertEquals(0, calls.get());
    }

    /**
     * Test 6: the loop processes jobs in priority order and stops on request.
     */
    @Test
    @Order(6)
    public void testLoopProcessesInPriorityOrder() throws Exception {
        store.enqueue(new CreateJobInput(1L, "low", "{}", "{}").setPriority(10));
        store.enqueue(new CreateJobInput(1L, "high", "{}", "{}").setPriority(90));
        store.enqueue(new CreateJobInput(1L, "mid", "{}", "{}").setPriority(50));

        List<String> order = new ArrayList<>();
        CountDownLatch allDone = new CountDownLatch(3);
        SimulationWorker worker = new SimulationWorker("test-worker", store, request -> {
            synchronized (order) {
                order.add(request.getServiceId());
            }
            allDone.countDown();
            return "{}";
        }, FAST_POLL);

        Thread thread = new Thread(worker, worker.getName());
        thread.start();

        assertTrue(allDone.await(10, TimeUnit.SECONDS), "All jobs should be processed");
        worker.stop();
        assertTrue(worker.awaitTermination(Duration.ofSeconds(5)), "Worker should stop");
        assertFalse(worker.isRunning());

        assertEquals(List.of("high", "mid", "low"), order);
    }

    /**
     * Test 7: stopping while a job is in flight lets that job finish.
     */
    @Test
    @Order(7)
    public void testStopLetsInFlightJobFinish() throws Exception {
        long id = enqueue("slow");
        long untouched = enqueue("next");

        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        SimulationWorker worker = new SimulationWorker("slow-worker", store, request -> {
            entered.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "{\"verdict\":\"approved\"}";
        }, FAST_POLL);

        Thread thread = new Thread(worker, worker.getName());
        thread.start();

        assertTrue(entered.await(5, TimeUnit.SECONDS), "Worker should pick up the job");
        worker.stop();
        assertFalse(worker.awaitTermination(Duration.ofMillis(200)), "Worker must wait for the in-flight job");

        release.countDown();
        assertTrue(worker.awaitTermination(Duration.ofSeconds(5)));

        assertEquals(JobStatus.COMPLETED, store.getJob(id).orElseThrow().getStatus());
        assertEquals(JobStatus.PENDING, store.getJob(untouched).orElseThrow().getStatus(),
            "No new job should be claimed after stop");
    }

    /**
     * Test 8: several workers share the queue without processing a job twice.
     */
    @Test
    @Order(8)
    public void testMultipleWorkers() throws Exception {
        int jobCount = 30;
        for (int i = 0; i < jobCount; i++) {
            enqueue("svc-" + i);
        }

        AtomicInteger calls = new AtomicInteger();
        List<SimulationWorker> workers = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            SimulationWorker worker = new SimulationWorker("worker-" + i, store, request -> {
                calls.incrementAndGet();
                return "{}";
            }, FAST_POLL);
            workers.add(worker);
            new Thread(worker, worker.getName()).start();
        }

        long deadline = System.currentTimeMillis() + 10_000;
        while (store.getQueueStats().get(JobStatus.COMPLETED) < jobCount && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }

        for (SimulationWorker worker : workers) {
            worker.stop();
        }
        for (SimulationWorker worker : workers) {
            assertTrue(worker.awaitTermination(Duration.ofSeconds(5)));
        }

        Map<JobStatus, Long> stats = store.getQueueStats();
        assertEquals((long) jobCount, stats.get(JobStatus.COMPLETED), "All jobs should be completed");
        assertEquals(jobCount, calls.get(), "Each job should be evaluated exactly once");
    }

    /**
     * Test 9: end to end against the JDBC store and an advisor stub over HTTP.
     */
    @Test
    @Order(9)
    public void testEndToEndWithHttpAdvisor() throws Exception {
        HttpServer advisor = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        advisor.createContext("/api/v1/evaluate", exchange -> {
            String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            boolean broken = body.contains("\"service_id\":\"broken\"");
            byte[] response = (broken ? "internal error" : "{\"verdict\":\"approved\"}").getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(broken ? 500 : 200, response.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(response);
            }
        });
        advisor.start();

        Database database = new Database("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "", 2);
        try {
            database.initialize();
            JdbcJobStore jdbcStore = new JdbcJobStore(database);
            long ok = jdbcStore.enqueue(new CreateJobInput(1L, "checkout", "{}", "{\"replicas\":4}")).getId();
            long broken = jdbcStore.enqueue(new CreateJobInput(1L, "broken", "{}", "{}")).getId();

            SimulationWorker worker = new SimulationWorker(jdbcStore,
                new HttpExecutionDelegate("http://localhost:" + advisor.getAddress().getPort()));
            assertTrue(worker.processNextJob());
            assertTrue(worker.processNextJob());
            assertFalse(worker.processNextJob());

            SimulationJob completed = jdbcStore.getJob(ok).orElseThrow();
            assertEquals(JobStatus.COMPLETED, completed.getStatus());
            assertEquals("{\"verdict\":\"approved\"}", completed.getResult());

            SimulationJob failed = jdbcStore.getJob(broken).orElseThrow();
            assertEquals(JobStatus.FAILED, failed.getStatus());
            assertTrue(failed.getErrorMessage().contains("500"), failed.getErrorMessage());
            assertTrue(failed.getErrorMessage().contains("internal error"), failed.getErrorMessage());
        } finally {
            database.close();
            advisor.stop(0);
        }
    }

    @Test
    @Order(10)
    public void testPollIntervalMustBePositive() {
        ExecutionDelegate delegate = request -> "{}";
        assertThrows(IllegalArgumentException.class,
            () -> new SimulationWorker("w", store, delegate, Duration.ZERO));
        assertEquals(SimulationWorker.DEFAULT_POLL_INTERVAL, new SimulationWorker(store, delegate).getPollInterval());
    }

    /**
     * Store whose result writes fail, as if the database dropped out after the evaluation.
     */
    private static final class ResultWriteFailingStore implements JobStore {
        private final JobStore target;

        ResultWriteFailingStore(JobStore target) {
            this.target = target;
        }

        @Override
        public SimulationJob enqueue(CreateJobInput input) throws SQLException {
            return target.enqueue(input);
        }

        @Override
        public Optional<SimulationJob> claimNextReady() throws SQLException {
            return target.claimNextReady();
        }

        @Override
        public boolean markCompleted(long jobId, String result) throws SQLException {
            throw new SQLException("disk full");
        }

        @Override
        public boolean markFailed(long jobId, String errorMessage) throws SQLException {
            return target.markFailed(jobId, errorMessage);
        }

        @Override
        public SimulationJob cancelJob(long jobId) throws SQLException {
            return target.cancelJob(jobId);
        }

        @Override
        public Optional<SimulationJob> getJob(long jobId) throws SQLException {
            return target.getJob(jobId);
        }

        @Override
        public JobPage listJobs(JobFilter filter, int limit, int offset) throws SQLException {
            return target.listJobs(filter, limit, offset);
        }

        @Override
        public Map<JobStatus, Long> getQueueStats() throws SQLException {
            return target.getQueueStats();
        }
    }
}
