package com.simqueue.db;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

// Fixed-size JDBC connection pool; runs schema.sql from the classpath on initialize()
public class Database {
    private static final Logger logger = Logger.getLogger(Database.class.getName());

    public static final String DEFAULT_URL = "jdbc:h2:./simqueue;AUTO_SERVER=TRUE";
    public static final int DEFAULT_POOL_SIZE = 10;
    private static final int CONNECTION_TIMEOUT_SECONDS = 30;
    private static final int VALIDATION_TIMEOUT_SECONDS = 2;
    private static final String SCHEMA_RESOURCE = "schema.sql";

    private final String url;
    private final String user;
    private final String password;
    private final int poolSize;
    private final BlockingQueue<Connection> connectionPool;
    private volatile boolean initialized = false;
    private volatile boolean closed = false;

    public Database(String url, String user, String password, int poolSize) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("pool size must be positive: " + poolSize);
        }
        this.url = url;
        this.user = user;
        this.password = password;
        this.poolSize = poolSize;
        this.connectionPool = new ArrayBlockingQueue<>(poolSize);
    }

    public Database(String url, String user, String password) {
        this(url, user, password, DEFAULT_POOL_SIZE);
    }

    public synchronized void initialize() throws SQLException {
        if (initialized) {
            logger.fine("Database already initialized");
            return;
        }

        logger.info("Initializing connection pool for " + url);

        for (int i = 0; i < poolSize; i++) {
            connectionPool.offer(createConnection());
        }
        logger.info("Connection pool created with " + poolSize + " connections");

        initializeSchema();

        initialized = true;
        logger.info("Database initialization complete");
    }

    private Connection createConnection() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    /**
     * Borrow a connection. Closing the returned connection hands it back to the pool.
     *
     * @return a pooled connection in auto-commit mode
     * @throws SQLException if the pool is not usable or no connection frees up in time
     */
    public Connection getConnection() throws SQLException {
        if (!initialized) {
            throw new SQLException("Database not initialized. Call initialize() first.");
        }

        if (closed) {
            throw new SQLException("Database has been closed");
        }

        try {
            Connection conn = connectionPool.poll(CONNECTION_TIMEOUT_SECONDS, TimeUnit.SECONDS);

            if (conn == null) {
                throw new SQLException("Timeout waiting for available connection");
            }

            if (conn.isClosed() || !conn.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                logger.warning("Connection invalid, creating new one");
                closeQuietly(conn);
                conn = createConnection();
            }

            return pooled(conn);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SQLException("Interrupted while waiting for connection", e);
        }
    }

    /**
     * @return true when the pool points at PostgreSQL, which supports single-statement
     *         {@code FOR UPDATE SKIP LOCKED} claims
     */
    public boolean isPostgres() {
        return url.startsWith("jdbc:postgresql:");
    }

    // Return connection to pool (called when a pooled connection is closed)
    synchronized void returnConnection(Connection connection) {
        if (connection == null) {
            return;
        }

        if (closed) {
            closeQuietly(connection);
            return;
        }

        try {
            if (connection.isClosed() || !connection.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                logger.warning("Connection invalid, creating replacement");
                closeQuietly(connection);
                connection = createConnection();
            } else if (!connection.getAutoCommit()) {
                // a borrower left a transaction open
                connection.rollback();
                connection.setAutoCommit(true);
            }

            if (!connectionPool.offer(connection)) {
                logger.severe("Connection pool full, closing connection");
                closeQuietly(connection);
            }

        } catch (SQLException e) {
            logger.log(Level.WARNING, "Error returning connection to pool", e);
            closeQuietly(connection);
        }
    }

    private void closeQuietly(Connection conn) {
        if (conn != null) {
            try {
                conn.close();
            } catch (SQLException e) {
                logger.log(Level.FINE, "Failed to close connection", e);
            }
        }
    }

    // Execute schema.sql statement by statement; every statement must be idempotent
    private void initializeSchema() throws SQLException {
        String schema = readSchema();
        if (schema == null) {
            logger.warning(SCHEMA_RESOURCE + " not found on classpath, skipping schema initialization");
            return;
        }

        Connection conn = connectionPool.peek();
        if (conn == null) {
            throw new SQLException("No connection available for schema initialization");
        }

        int executedCount = 0;
        try (Statement stmt = conn.createStatement()) {
            StringBuilder currentStatement = new StringBuilder();

            for (String line : schema.split("\n")) {
                line = line.trim();
                if (line.startsWith("--") || line.isEmpty()) {
                    continue;
                }

                currentStatement.append(line).append(" ");

                if (line.endsWith(";")) {
                    String sql = currentStatement.toString().trim();
                    sql = sql.substring(0, sql.length() - 1).trim();
                    if (!sql.isEmpty()) {
                        stmt.execute(sql);
                        executedCount++;
                    }
                    currentStatement = new StringBuilder();
                }
            }
        }

        logger.info("Schema initialized (" + executedCount + " statements)");
    }

    private String readSchema() throws SQLException {
        try (InputStream in = Database.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                return null;
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SQLException("Failed to read " + SCHEMA_RESOURCE, e);
        }
    }

    public synchronized void close() {
        if (closed) {
            logger.fine("Database already closed");
            return;
        }

        logger.info("Closing database connections...");
        closed = true;

        Connection conn;
        int closedCount = 0;

        while ((conn = connectionPool.poll()) != null) {
            try {
                if (!conn.isClosed()) {
                    conn.close();
                    closedCount++;
                }
            } catch (SQLException e) {
                logger.log(Level.WARNING, "Error closing connection", e);
            }
        }

        logger.info("Closed " + closedCount + " database connections");
    }

    public boolean isInitialized() {
        return initialized;
    }

    public boolean isClosed() {
        return closed;
    }

    // Wraps a physical connection so that close() returns it to this pool
    private Connection pooled(Connection delegate) {
        return (Connection) Proxy.newProxyInstance(
            Database.class.getClassLoader(),
            new Class<?>[] {Connection.class},
            new PooledConnectionHandler(delegate));
    }

    private class PooledConnectionHandler implements InvocationHandler {
        private final Connection delegate;
        private boolean released = false;

        PooledConnectionHandler(Connection delegate) {
            this.delegate = delegate;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            switch (method.getName()) {
                case "close":
                    if (!released) {
                        released = true;
                        returnConnection(delegate);
                    }
                    return null;
                case "isClosed":
                    return released || delegate.isClosed();
                case "equals":
                    return proxy == args[0];
                case "hashCode":
                    return System.identityHashCode(proxy);
                case "toString":
                    return "Pooled[" + delegate + "]";
                case "unwrap":
                    if (((Class<?>) args[0]).isInstance(proxy)) {
                        return proxy;
                    }
                    break;
                default:
                    if (released) {
                        throw new SQLException("Connection already returned to pool");
                    }
            }

            try {
                return method.invoke(delegate, args);
            } catch (InvocationTargetException e) {
                throw e.getCause();
            }
        }
    }
}
