package com.simqueue.delegate;

import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Calls the advisor's {@code POST /api/v1/evaluate} endpoint.
 *
 * <p>The request body is a JSON object with {@code service_id}, {@code current_config},
 * {@code proposed_config} and, when set, {@code llm_provider}, {@code prompt_version_id},
 * {@code context} and {@code options}. Configuration blobs are embedded as JSON values,
 * not as strings. Any 2xx response body is returned verbatim.</p>
 *
 * <p>The timeout bounds the whole exchange (connect, upload and full body read), not a
 * single socket read: a call still open at the deadline is disconnected.</p>
 */
public class HttpExecutionDelegate implements ExecutionDelegate {
    private static final Logger logger = Logger.getLogger(HttpExecutionDelegate.class.getName());

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final String EVALUATE_PATH = "/api/v1/evaluate";

    // Disconnects calls that outlive their deadline
    private static final ScheduledExecutorService WATCHDOG = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "advisor-call-watchdog");
        thread.setDaemon(true);
        return thread;
    });

    private final String advisorUrl;
    private final Duration timeout;

    /**
     * @param advisorUrl base URL of the advisor, e.g. {@code http://advisor:8000}
     * @param timeout how long to wait for the evaluation response
     */
    public HttpExecutionDelegate(String advisorUrl, Duration timeout) {
        this.advisorUrl = advisorUrl.endsWith("/") ? advisorUrl.substring(0, advisorUrl.length() - 1) : advisorUrl;
        this.timeout = timeout;
    }

    public HttpExecutionDelegate(String advisorUrl) {
        this(advisorUrl, DEFAULT_TIMEOUT);
    }

    @Override
    public String evaluate(EvaluationRequest request) throws DelegateCallException {
        byte[] body;
        try {
            body = buildRequestBody(request).toString().getBytes(StandardCharsets.UTF_8);
        } catch (JSONException e) {
            throw new DelegateCallException("marshal request: " + e.getMessage(), e);
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        AtomicBoolean expired = new AtomicBoolean(false);
        ScheduledFuture<?> watchdogTask = null;
        HttpURLConnection conn = null;
        long startTime = System.currentTimeMillis();
        try {
            URL url = URI.create(advisorUrl + EVALUATE_PATH).toURL();
            conn = (HttpURLConnection) url.openConnection();
            conn.setRequestMethod("POST");
            conn.setDoOutput(true);
            conn.setConnectTimeout((int) Math.min(CONNECT_TIMEOUT.toMillis(), timeout.toMillis()));
            conn.setReadTimeout((int) timeout.toMillis());
            conn.setRequestProperty("Content-Type", "application/json");
            conn.setRequestProperty("Accept", "application/json");
            conn.setFixedLengthStreamingMode(body.length);

            HttpURLConnection active = conn;
            watchdogTask = WATCHDOG.schedule(() -> {
                expired.set(true);
                active.disconnect();
            }, timeout.toMillis(), TimeUnit.MILLISECONDS);

            try (OutputStream os = conn.getOutputStream()) {
                os.write(body);
            }

            int statusCode = conn.getResponseCode();
            String responseBody = readBody(statusCode >= 400 ? conn.getErrorStream() : conn.getInputStream(), deadline);
            long duration = System.currentTimeMillis() - startTime;

            if (statusCode < 200 || statusCode >= 300) {
                logger.warning("Advisor returned " + statusCode + " for service " + request.getServiceId()
                    + " after " + duration + "ms");
                throw new DelegateCallException(statusCode, responseBody);
            }

            logger.info("Advisor evaluated service " + request.getServiceId() + " in " + duration + "ms");
            return responseBody;

        } catch (SocketTimeoutException e) {
            throw timedOut(e);
        } catch (IOException | IllegalArgumentException e) {
            if (expired.get()) {
                throw timedOut(e);
            }
            throw new DelegateCallException("execute request: " + e.getMessage(), e);
        } finally {
            if (watchdogTask != null) {
                watchdogTask.cancel(false);
            }
            if (conn != null) {
                conn.disconnect();
            }
        }
    }

    private DelegateCallException timedOut(Exception cause) {
        logger.warning("Advisor call timed out after " + timeout.toMillis() + "ms");
        return new DelegateCallException("execute request: timed out after " + timeout.toMillis() + "ms", cause);
    }

    static JSONObject buildRequestBody(EvaluationRequest request) {
        JSONObject json = new JSONObject();
        json.put("service_id", request.getServiceId());
        json.put("current_config", parseValue(request.getCurrentConfig()));
        json.put("proposed_config", parseValue(request.getProposedConfig()));

        if (request.getLlmProvider() != null) {
            json.put("llm_provider", request.getLlmProvider());
        }
        if (request.getPromptVersionId() != null) {
            json.put("prompt_version_id", request.getPromptVersionId().intValue());
        }
        if (request.getContext() != null) {
            json.put("context", parseValue(request.getContext()));
        }
        if (request.getOptions() != null) {
            json.put("options", parseValue(request.getOptions()));
        }
        return json;
    }

    private static Object parseValue(String rawJson) {
        return new JSONTokener(rawJson).nextValue();
    }

    // Reads the full body, giving up once the call deadline has passed
    private static String readBody(InputStream in, long deadline) throws IOException {
        if (in == null) {
            return "";
        }
        try (InputStream stream = in) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buffer = new byte[8192];
            int read;
            while ((read = stream.read(buffer)) != -1) {
                out.write(buffer, 0, read);
                if (System.nanoTime() - deadline > 0) {
                    throw new SocketTimeoutException("response body not complete at deadline");
                }
            }
            return out.toString(StandardCharsets.UTF_8);
        }
    }
}
