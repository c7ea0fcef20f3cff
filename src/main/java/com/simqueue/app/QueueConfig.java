package com.simqueue.app;

import com.simqueue.db.Database;
import com.simqueue.delegate.HttpExecutionDelegate;
import com.simqueue.engine.SimulationWorker;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Service settings.
 *
 * <p>Sources, later ones winning: built-in defaults, {@code simqueue.properties} on the
 * classpath, an optional properties file given on the command line, then environment
 * variables ({@code SERVER_PORT}, {@code DB_URL}, {@code DB_USER}, {@code DB_PASSWORD},
 * {@code ADVISOR_URL}, {@code WORKER_COUNT}).</p>
 */
public class QueueConfig {
    private static final Logger logger = Logger.getLogger(QueueConfig.class.getName());

    static final String CLASSPATH_RESOURCE = "simqueue.properties";

    public static final String SERVER_PORT = "server.port";
    public static final String DB_URL = "db.url";
    public static final String DB_USER = "db.user";
    public static final String DB_PASSWORD = "db.password";
    public static final String DB_POOL_SIZE = "db.pool.size";
    public static final String ADVISOR_URL = "advisor.url";
    public static final String ADVISOR_TIMEOUT_SECONDS = "advisor.timeout.seconds";
    public static final String WORKER_COUNT = "worker.count";
    public static final String WORKER_POLL_INTERVAL_MS = "worker.poll.interval.ms";
    public static final String AUTH_SESSIONS = "auth.sessions";
    public static final String AUTH_ALLOW_ALL = "auth.permissions.allow-all";

    private static final Map<String, String> ENV_OVERRIDES = Map.of(
        "SERVER_PORT", SERVER_PORT,
        "DB_URL", DB_URL,
        "DB_USER", DB_USER,
        "DB_PASSWORD", DB_PASSWORD,
        "ADVISOR_URL", ADVISOR_URL,
        "WORKER_COUNT", WORKER_COUNT);

    private final Properties properties;

    QueueConfig(Properties properties) {
        this.properties = properties;
    }

    static Properties defaults() {
        Properties defaults = new Properties();
        defaults.setProperty(SERVER_PORT, "8080");
        defaults.setProperty(DB_URL, Database.DEFAULT_URL);
        defaults.setProperty(DB_USER, "sa");
        defaults.setProperty(DB_PASSWORD, "");
        defaults.setProperty(DB_POOL_SIZE, String.valueOf(Database.DEFAULT_POOL_SIZE));
        defaults.setProperty(ADVISOR_URL, "http://localhost:8000");
        defaults.setProperty(ADVISOR_TIMEOUT_SECONDS, String.valueOf(HttpExecutionDelegate.DEFAULT_TIMEOUT.toSeconds()));
        defaults.setProperty(WORKER_COUNT, "1");
        defaults.setProperty(WORKER_POLL_INTERVAL_MS, String.valueOf(SimulationWorker.DEFAULT_POLL_INTERVAL.toMillis()));
        defaults.setProperty(AUTH_SESSIONS, "");
        defaults.setProperty(AUTH_ALLOW_ALL, "true");
        return defaults;
    }

    /**
     * Load the configuration from all sources.
     *
     * @param externalFile optional properties file, may be null
     * @param env environment variables
     * @return the merged configuration
     * @throws IOException if a properties file cannot be read
     */
    public static QueueConfig load(Path externalFile, Map<String, String> env) throws IOException {
        Properties merged = defaults();

        try (InputStream in = QueueConfig.class.getClassLoader().getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in != null) {
                merged.load(in);
                logger.fine("Loaded " + CLASSPATH_RESOURCE + " from classpath");
            }
        }

        if (externalFile != null) {
            try (Reader reader = Files.newBufferedReader(externalFile, StandardCharsets.UTF_8)) {
                merged.load(reader);
                logger.info("Loaded configuration from " + externalFile);
            }
        }

        for (Map.Entry<String, String> override : ENV_OVERRIDES.entrySet()) {
            String value = env.get(override.getKey());
            if (value != null && !value.isEmpty()) {
                merged.setProperty(override.getValue(), value);
            }
        }

        return new QueueConfig(merged);
    }

    public int getServerPort() {
        return getInt(SERVER_PORT);
    }

    public String getDbUrl() {
        return properties.getProperty(DB_URL);
    }

    public String getDbUser() {
        return properties.getProperty(DB_USER);
    }

    public String getDbPassword() {
        return properties.getProperty(DB_PASSWORD);
    }

    public int getDbPoolSize() {
        return getInt(DB_POOL_SIZE);
    }

    public String getAdvisorUrl() {
        return properties.getProperty(ADVISOR_URL);
    }

    public Duration getAdvisorTimeout() {
        return Duration.ofSeconds(getInt(ADVISOR_TIMEOUT_SECONDS));
    }

    public int getWorkerCount() {
        return getInt(WORKER_COUNT);
    }

    public Duration getWorkerPollInterval() {
        return Duration.ofMillis(getInt(WORKER_POLL_INTERVAL_MS));
    }

    public String getAuthSessions() {
        return properties.getProperty(AUTH_SESSIONS, "");
    }

    public boolean isAllowAllPermissions() {
        return Boolean.parseBoolean(properties.getProperty(AUTH_ALLOW_ALL));
    }

    private int getInt(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalStateException("configuration key " + key + " is not set");
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("configuration key " + key + " must be an integer, got '" + value + "'", e);
        }
    }
}
