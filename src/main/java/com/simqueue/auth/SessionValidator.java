package com.simqueue.auth;

import java.io.IOException;
import java.util.Optional;

/**
 * Resolves a session token to the id of an active user. Session storage lives outside
 * this service.
 */
public interface SessionValidator {

    /**
     * @param sessionId the token presented by the caller
     * @return the user id, or empty for an unknown or expired session
     * @throws IOException if the session backend cannot be reached
     */
    Optional<Long> resolveUserId(String sessionId) throws IOException;
}
