package com.simqueue.app;

import com.google.gson.JsonObject;
import com.simqueue.auth.PermissionChecker;
import com.simqueue.auth.SessionValidator;
import com.simqueue.core.CreateJobInput;
import com.simqueue.core.JobConflictException;
import com.simqueue.core.JobFilter;
import com.simqueue.core.JobNotFoundException;
import com.simqueue.core.JobPage;
import com.simqueue.core.JobStatus;
import com.simqueue.core.JobStore;
import com.simqueue.core.JobValidationException;
import com.simqueue.core.SimulationJob;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

// HTTP server exposing the simulation queue under /api/v1/simulations/queue
public class QueueApiServer {
    private static final Logger logger = Logger.getLogger(QueueApiServer.class.getName());

    static final String BASE_PATH = "/api/v1/simulations/queue";
    static final String SESSION_COOKIE = "session_id";
    static final String SESSION_HEADER = "X-Session-Id";
    static final int DEFAULT_LIMIT = 20;

    private final JobStore store;
    private final SessionValidator sessions;
    private final PermissionChecker permissions;
    private final int port;
    private HttpServer server;
    private ExecutorService executor;

    public QueueApiServer(JobStore store, SessionValidator sessions, PermissionChecker permissions, int port) {
        this.store = store;
        this.sessions = sessions;
        this.permissions = permissions;
        this.port = port;
    }

    // Start HTTP server and register the queue endpoints
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext(BASE_PATH, new QueueHandler());

        executor = Executors.newFixedThreadPool(4);
        server.setExecutor(executor);
        server.start();

        logger.info("Queue API started on port " + getPort() + " at " + BASE_PATH);
    }

    // Stop HTTP server gracefully
    public void stop() {
        if (server != null) {
            server.stop(2);
            executor.shutdown();
            logger.info("Queue API stopped");
        }
    }

    /**
     * @return the bound port; differs from the configured one when that was 0
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    private class QueueHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod().toUpperCase();
            String path = exchange.getRequestURI().getPath();
            String subPath = path.substring(BASE_PATH.length());
            if (subPath.endsWith("/")) {
                subPath = subPath.substring(0, subPath.length() - 1);
            }

            try {
                Optional<Long> userId = authenticate(exchange);
                if (userId.isEmpty()) {
                    sendError(exchange, 401, "authentication required");
                    return;
                }

                if (subPath.isEmpty()) {
                    switch (method) {
                        case "POST" -> enqueue(exchange, userId.get());
                        case "GET" -> listJobs(exchange, userId.get());
                        default -> sendError(exchange, 405, "Method Not Allowed");
                    }
                } else if (subPath.equals("/stats")) {
                    if (!"GET".equals(method)) {
                        sendError(exchange, 405, "Method Not Allowed");
                    } else if (authorize(exchange, userId.get(), PermissionChecker.VIEW_HISTORY)) {
                        sendJson(exchange, 200, JobJson.stats(store.getQueueStats()));
                    }
                } else if (subPath.lastIndexOf('/') == 0) {
                    long jobId = parseJobId(subPath.substring(1));
                    switch (method) {
                        case "GET" -> getJob(exchange, userId.get(), jobId);
                        case "DELETE" -> cancelJob(exchange, userId.get(), jobId);
                        default -> sendError(exchange, 405, "Method Not Allowed");
                    }
                } else {
                    sendError(exchange, 404, "not found");
                }

            } catch (JobValidationException e) {
                sendError(exchange, 400, e.getMessage());
            } catch (JobNotFoundException e) {
                sendError(exchange, 404, "job not found");
            } catch (JobConflictException e) {
                sendError(exchange, 409, "job is " + e.getCurrentStatus() + ", only pending jobs can be cancelled");
            } catch (SQLException e) {
                logger.log(Level.SEVERE, "Job store unavailable for " + method + " " + path, e);
                sendError(exchange, 503, "job store unavailable");
            } catch (AuthBackendException e) {
                logger.log(Level.SEVERE, "Auth backend unavailable for " + method + " " + path, e.getCause());
                sendError(exchange, 503, "service unavailable");
            } catch (IOException e) {
                // client connection; no response can be delivered
                logger.log(Level.WARNING, "I/O error handling " + method + " " + path, e);
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Unexpected error handling " + method + " " + path, e);
                sendError(exchange, 500, "Internal Server Error");
            } finally {
                exchange.close();
            }
        }

        private void enqueue(HttpExchange exchange, long userId) throws IOException, SQLException {
            if (!authorize(exchange, userId, PermissionChecker.RUN_SIMULATION)) {
                return;
            }
            CreateJobInput input = JobJson.createInput(readBody(exchange), userId);
            SimulationJob job = store.enqueue(input);
            sendJson(exchange, 201, JobJson.wrap("job", JobJson.job(job)));
        }

        private void listJobs(HttpExchange exchange, long userId) throws IOException, SQLException {
            if (!authorize(exchange, userId, PermissionChecker.VIEW_HISTORY)) {
                return;
            }
            Map<String, String> query = parseQuery(exchange.getRequestURI().getRawQuery());

            JobStatus status = null;
            String statusParam = query.get("status");
            if (statusParam != null && !statusParam.isEmpty()) {
                status = JobStatus.fromValue(statusParam);
            }
            int limit = parseIntParam(query.get("limit"), DEFAULT_LIMIT, 1);
            int offset = parseIntParam(query.get("offset"), 0, 0);

            JobPage page = store.listJobs(JobFilter.of(userId, status), limit, offset);
            sendJson(exchange, 200, JobJson.page(page));
        }

        private void getJob(HttpExchange exchange, long userId, long jobId) throws IOException, SQLException {
            if (!authorize(exchange, userId, PermissionChecker.VIEW_HISTORY)) {
                return;
            }
            Optional<SimulationJob> job = store.getJob(jobId);
            if (job.isEmpty()) {
                sendError(exchange, 404, "job not found");
                return;
            }
            sendJson(exchange, 200, JobJson.wrap("job", JobJson.job(job.get())));
        }

        private void cancelJob(HttpExchange exchange, long userId, long jobId) throws IOException, SQLException {
            if (!authorize(exchange, userId, PermissionChecker.RUN_SIMULATION)) {
                return;
            }
            store.cancelJob(jobId);
            sendJson(exchange, 200, JobJson.message("message", "job cancelled"));
        }

        private Optional<Long> authenticate(HttpExchange exchange) throws AuthBackendException {
            String sessionId = exchange.getRequestHeaders().getFirst(SESSION_HEADER);
            if (sessionId == null) {
                sessionId = sessionCookie(exchange.getRequestHeaders().getFirst("Cookie"));
            }
            if (sessionId == null || sessionId.isEmpty()) {
                return Optional.empty();
            }
            try {
                return sessions.resolveUserId(sessionId);
            } catch (IOException e) {
                throw new AuthBackendException("session lookup failed", e);
            }
        }

        private boolean authorize(HttpExchange exchange, long userId, String permission) throws IOException {
            boolean granted;
            try {
                granted = permissions.hasPermission(userId, permission);
            } catch (IOException e) {
                throw new AuthBackendException("permission check failed", e);
            }
            if (granted) {
                return true;
            }
            logger.warning("User " + userId + " lacks permission " + permission);
            sendError(exchange, 403, "permission denied: " + permission);
            return false;
        }

        private String readBody(HttpExchange exchange) throws IOException {
            try (InputStream in = exchange.getRequestBody()) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        }

        private void sendJson(HttpExchange exchange, int statusCode, JsonObject body) throws IOException {
            byte[] response = JobJson.toJson(body).getBytes(StandardCharsets.UTF_8);

            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(statusCode, response.length);

            try (OutputStream os = exchange.getResponseBody()) {
                os.write(response);
            }
        }

        private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
            sendJson(exchange, statusCode, JobJson.message("error", message));
        }
    }

    // Session or permission backend failure, kept apart from client connection errors
    private static class AuthBackendException extends IOException {
        AuthBackendException(String message, IOException cause) {
            super(message, cause);
        }
    }

    static String sessionCookie(String cookieHeader) {
        if (cookieHeader == null) {
            return null;
        }
        for (String cookie : cookieHeader.split(";")) {
            String[] pair = cookie.trim().split("=", 2);
            if (pair.length == 2 && pair[0].equals(SESSION_COOKIE)) {
                return pair[1];
            }
        }
        return null;
    }

    static long parseJobId(String text) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new JobValidationException("invalid job ID: " + text, e);
        }
    }

    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            String[] parts = pair.split("=", 2);
            try {
                String key = URLDecoder.decode(parts[0], StandardCharsets.UTF_8);
                String value = parts.length > 1 ? URLDecoder.decode(parts[1], StandardCharsets.UTF_8) : "";
                params.putIfAbsent(key, value);
            } catch (IllegalArgumentException e) {
                throw new JobValidationException("invalid query string: " + rawQuery, e);
            }
        }
        return params;
    }

    // Unparsable or out-of-range values fall back to the default
    static int parseIntParam(String value, int defaultValue, int minimum) {
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value);
            return parsed >= minimum ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
