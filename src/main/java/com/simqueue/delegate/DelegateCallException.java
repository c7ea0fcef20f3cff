package com.simqueue.delegate;

/**
 * Thrown when the evaluator call does not produce a result: a non-2xx response,
 * a transport failure or a timeout.
 *
 * <p>The message is what ends up in the failed job's {@code error_message}, so it
 * carries the status code and response body, or the underlying transport error.</p>
 */
public class DelegateCallException extends Exception {

    /** Status code used when no HTTP response was received. */
    public static final int NO_RESPONSE = -1;

    private final int statusCode;
    private final String responseBody;

    /**
     * Create an exception for a response outside the 2xx range.
     *
     * @param statusCode the HTTP status code
     * @param responseBody the response body, possibly empty
     */
    public DelegateCallException(int statusCode, String responseBody) {
        super("advisor returned " + statusCode + ": " + responseBody);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    /**
     * Create an exception for a call that produced no usable response.
     *
     * @param message what went wrong
     * @param cause the underlying error
     */
    public DelegateCallException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_RESPONSE;
        this.responseBody = null;
    }

    /**
     * @return the HTTP status code, or {@link #NO_RESPONSE}
     */
    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
