package com.simqueue.auth;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed token-to-user table, for local runs and tests.
 *
 * <p>Parsed from {@code token:userId} pairs separated by commas, e.g.
 * {@code "dev-token:1,analyst-token:7"}.</p>
 */
public class StaticSessionValidator implements SessionValidator {
    private final Map<String, Long> sessions;

    public StaticSessionValidator(Map<String, Long> sessions) {
        this.sessions = Collections.unmodifiableMap(new HashMap<>(sessions));
    }

    public static StaticSessionValidator parse(String table) {
        Map<String, Long> sessions = new HashMap<>();
        if (table != null) {
            for (String entry : table.split(",")) {
                String trimmed = entry.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                int colon = trimmed.lastIndexOf(':');
                if (colon <= 0 || colon == trimmed.length() - 1) {
                    throw new IllegalArgumentException("session entry must be token:userId, got '" + trimmed + "'");
                }
                try {
                    sessions.put(trimmed.substring(0, colon), Long.parseLong(trimmed.substring(colon + 1)));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("invalid user id in session entry '" + trimmed + "'", e);
                }
            }
        }
        return new StaticSessionValidator(sessions);
    }

    @Override
    public Optional<Long> resolveUserId(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public int size() {
        return sessions.size();
    }
}
