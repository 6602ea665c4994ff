package com.purchasingpower.coderag.util;

import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.neo4j.driver.exceptions.TransientException;
import redis.clients.jedis.exceptions.JedisConnectionException;

import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Classifies failures of external calls as retryable or not.
 *
 * <p>Connection problems, timeouts, rate limiting and 5xx responses are transient.
 * Anything else (bad input, auth, schema) fails immediately.
 */
public final class TransientErrors {

    private static final String[] TRANSIENT_MARKERS = {
            "429", "500", "502", "503", "504",
            "rate limit", "too many requests", "timed out", "timeout",
            "connection refused", "connection reset", "service unavailable"
    };

    private TransientErrors() {
    }

    public static boolean isTransient(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 10) {
            if (current instanceof IOException
                    || current instanceof TimeoutException
                    || current instanceof ServiceUnavailableException
                    || current instanceof SessionExpiredException
                    || current instanceof TransientException
                    || current instanceof JedisConnectionException) {
                return true;
            }
            if (hasTransientMarker(current.getMessage())) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }

    private static boolean hasTransientMarker(String message) {
        if (message == null || message.isEmpty()) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String marker : TRANSIENT_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
