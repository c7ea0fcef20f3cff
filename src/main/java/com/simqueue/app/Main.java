package com.simqueue.app;

import com.simqueue.auth.PermissionChecker;
import com.simqueue.auth.StaticSessionValidator;
import com.simqueue.db.Database;
import com.simqueue.db.JdbcJobStore;
import com.simqueue.delegate.HttpExecutionDelegate;
import com.simqueue.engine.SimulationWorker;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point of the simulation queue service.
 * Starts the job store, the simulation workers and the queue API.
 *
 * <p>Usage: {@code java com.simqueue.app.Main [config.properties]}</p>
 */
public class Main {
    private static final Logger logger = Logger.getLogger(Main.class.getName());
    // Time for a worker to write the outcome after its advisor call returns
    static final Duration WORKER_STOP_MARGIN = Duration.ofSeconds(30);

    private static Database database;
    private static Duration workerStopTimeout = WORKER_STOP_MARGIN;
    private static QueueApiServer apiServer;
    private static final List<SimulationWorker> workers = new ArrayList<>();
    private static final List<Thread> workerThreads = new ArrayList<>();

    public static void main(String[] args) {
        configureLogging();
        logger.info("=== Simulation Queue Starting ===");

        try {
            QueueConfig config = QueueConfig.load(args.length > 0 ? Path.of(args[0]) : null, System.getenv());

            // 1. Database and job store
            JdbcJobStore store = initializeStore(config);

            // 2. Workers
            startWorkers(config, store);

            // 3. Queue API
            startApiServer(config, store);

            // 4. Graceful shutdown
            addShutdownHook();

            logger.info("=== Simulation Queue is running ===");

            // Worker threads are non-daemon, the JVM stays up until the hook stops them
            for (Thread thread : workerThreads) {
                thread.join();
            }

        } catch (InterruptedException e) {
            logger.info("Main thread interrupted");
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Fatal error during startup", e);
            System.exit(1);
        }
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not read logging.properties, using JVM defaults", e);
        }
    }

    private static JdbcJobStore initializeStore(QueueConfig config) {
        try {
            logger.info("Initializing database at " + config.getDbUrl() + "...");
            database = new Database(config.getDbUrl(), config.getDbUser(), config.getDbPassword(),
                config.getDbPoolSize());
            database.initialize();
            logger.info("Database initialized successfully");
            return new JdbcJobStore(database);
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to initialize database", e);
            throw new RuntimeException("Database initialization failed", e);
        }
    }

    private static void startWorkers(QueueConfig config, JdbcJobStore store) {
        int count = config.getWorkerCount();
        if (count < 1) {
            throw new IllegalStateException(QueueConfig.WORKER_COUNT + " must be at least 1, got " + count);
        }
        HttpExecutionDelegate delegate = new HttpExecutionDelegate(config.getAdvisorUrl(), config.getAdvisorTimeout());
        workerStopTimeout = workerStopTimeout(config);
        logger.info("Starting " + count + " simulation worker(s) against " + config.getAdvisorUrl());

        for (int i = 1; i <= count; i++) {
            SimulationWorker worker = new SimulationWorker("simulation-worker-" + i, store, delegate,
                config.getWorkerPollInterval());
            Thread thread = new Thread(worker, worker.getName());
            thread.setDaemon(false);
            workers.add(worker);
            workerThreads.add(thread);
            thread.start();
        }
    }

    private static void startApiServer(QueueConfig config, JdbcJobStore store) {
        try {
            StaticSessionValidator sessions = StaticSessionValidator.parse(config.getAuthSessions());
            if (sessions.size() == 0) {
                logger.warning("No sessions configured (" + QueueConfig.AUTH_SESSIONS + "), every API call will be rejected");
            }
            PermissionChecker permissions = config.isAllowAllPermissions()
                ? PermissionChecker.allowAll()
                : (userId, permission) -> false;

            apiServer = new QueueApiServer(store, sessions, permissions, config.getServerPort());
            apiServer.start();
            logger.info("Queue API available at http://localhost:" + apiServer.getPort() + QueueApiServer.BASE_PATH);
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to start queue API", e);
            throw new RuntimeException("Queue API initialization failed", e);
        }
    }

    /**
     * An in-flight job may still be inside its advisor call when shutdown starts.
     */
    static Duration workerStopTimeout(QueueConfig config) {
        return config.getAdvisorTimeout().plus(WORKER_STOP_MARGIN);
    }

    private static void addShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("=== Shutdown signal received ===");
            shutdown(workers, apiServer, database, workerStopTimeout);
            logger.info("=== Simulation Queue Stopped ===");
        }, "Shutdown-Hook"));

        logger.info("Shutdown hook registered");
    }

    /**
     * Stop the workers first so in-flight jobs can finish, then the API, then the pool.
     * The pool stays open while any worker is still running so its outcome can be written.
     *
     * @return true if every worker stopped and the pool was closed
     */
    static boolean shutdown(List<SimulationWorker> workers, QueueApiServer server, Database db, Duration timeout) {
        for (SimulationWorker worker : workers) {
            worker.stop();
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        for (SimulationWorker worker : workers) {
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                if (!worker.awaitTermination(Duration.ofNanos(remaining))) {
                    logger.warning(worker.getName() + " did not stop within " + timeout.toSeconds() + "s");
                }
            } catch (InterruptedException e) {
                logger.log(Level.WARNING, "Interrupted while waiting for " + worker.getName(), e);
                Thread.currentThread().interrupt();
                break;
            }
        }

        if (server != null) {
            server.stop();
        }

        for (SimulationWorker worker : workers) {
            if (worker.isRunning()) {
                logger.warning("Leaving database open: " + worker.getName() + " is still processing a job");
                return false;
            }
        }

        if (db != null) {
            logger.info("Closing database connections...");
            db.close();
        }
        return true;
    }
}
