package com.simqueue.db;

import com.simqueue.core.CreateJobInput;
import com.simqueue.core.JobFilter;
import com.simqueue.core.JobStatus;
import com.simqueue.core.JobStore;
import com.simqueue.core.SimulationJob;
import org.junit.jupiter.api.*;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent claimers must never receive the same job.
 */
public class ConcurrentClaimTest {

    private static final int CLAIMERS = 8;

    private Database database;

    @BeforeEach
    public void setUp() throws SQLException {
        database = new Database("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "", CLAIMERS);
        database.initialize();
    }

    @AfterEach
    public void tearDown() {
        if (database != null) {
            database.close();
        }
    }

    private static void enqueue(JobStore store, int count) throws SQLException {
        for (int i = 0; i < count; i++) {
            store.enqueue(new CreateJobInput(1L, "svc-" + i, "{}", "{\"i\":" + i + "}").setPriority(i % 3 * 10));
        }
    }

    /**
     * Start all claimers at once, each draining until the queue is empty.
     */
    private static List<Long> drainConcurrently(JobStore store) throws InterruptedException {
        ConcurrentLinkedQueue<Long> claimed = new ConcurrentLinkedQueue<>();
        ConcurrentLinkedQueue<Throwable> errors = new ConcurrentLinkedQueue<>();
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(CLAIMERS);

        for (int t = 0; t < CLAIMERS; t++) {
            Thread thread = new Thread(() -> {
                try {
                    start.await();
                    Optional<SimulationJob> job;
                    while ((job = store.claimNextReady()).isPresent()) {
                        claimed.add(job.get().getId());
                    }
                } catch (Throwable e) {
                    errors.add(e);
                } finally {
                    done.countDown();
                }
            }, "claimer-" + t);
            thread.start();
        }

        start.countDown();
        assertTrue(done.await(60, TimeUnit.SECONDS), "Claimers should finish");
        assertTrue(errors.isEmpty(), "Claimers should not fail: " + errors);
        return new ArrayList<>(claimed);
    }

    private static void assertDistinct(List<Long> ids) {
        Set<Long> unique = new HashSet<>(ids);
        assertEquals(ids.size(), unique.size(), "A job was claimed more than once: " + ids);
    }

    @Test
    public void testJdbcStoreClaimsEachJobOnce() throws Exception {
        JdbcJobStore store = new JdbcJobStore(database);
        enqueue(store, 40);

        List<Long> claimed = drainConcurrently(store);

        assertEquals(40, claimed.size(), "Every job should be claimed");
        assertDistinct(claimed);
        assertEquals(40L, store.getQueueStats().get(JobStatus.RUNNING));
    }

    @Test
    public void testFewerJobsThanClaimers() throws Exception {
        JdbcJobStore store = new JdbcJobStore(database);
        enqueue(store, 3);

        List<Long> claimed = drainConcurrently(store);

        assertEquals(3, claimed.size(), "Exactly the available jobs should be claimed");
        assertDistinct(claimed);
        assertEquals(0, store.listJobs(JobFilter.of(null, JobStatus.PENDING), 10, 0).getTotal());
    }

    @Test
    public void testInMemoryStoreClaimsEachJobOnce() throws Exception {
        InMemoryJobStore store = new InMemoryJobStore();
        enqueue(store, 40);

        List<Long> claimed = drainConcurrently(store);

        assertEquals(40, claimed.size());
        assertDistinct(claimed);
    }
}
