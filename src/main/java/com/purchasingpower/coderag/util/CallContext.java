package com.purchasingpower.coderag.util;

import org.slf4j.Logger;

import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Trace of one call to an embedding model, graph store, lock server or disk.
 *
 * <p>All lines of a call share a short id. Completed calls slower than the
 * service's threshold are logged at WARN so they show up without debug logging.
 */
public final class CallContext {

    private final String callId;
    private final ServiceType service;
    private final String operation;
    private final long startNanos;
    private final Logger logger;

    private CallContext(ServiceType service, String operation, Logger logger) {
        this.callId = UUID.randomUUID().toString().substring(0, 8);
        this.service = service;
        this.operation = operation;
        this.startNanos = System.nanoTime();
        this.logger = logger;
    }

    public static CallContext start(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Shortens text (queries, chunk content) for log lines.
     */
    public static String abbreviate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }

    /**
     * @param details alternating key/value pairs
     */
    public void logRequest(String summary, Object... details) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        logger.debug("{} {} → {} [{}]{}", service.getEmoji(), service.getDisplayName(), operation, callId,
                summary == null || summary.isEmpty() ? "" : " " + summary);
        logPairs(details);
    }

    public void logResponse(String summary, Object... details) {
        long elapsed = getElapsedMs();
        if (elapsed > service.getSlowCall().toMillis()) {
            logger.warn("🐢 {} {} ← {} [{}] took {}ms: {}", service.getEmoji(), service.getDisplayName(),
                    operation, callId, elapsed, summary);
        } else if (logger.isDebugEnabled()) {
            logger.debug("{} {} ← {} [{}] ({}ms) {}", service.getEmoji(), service.getDisplayName(),
                    operation, callId, elapsed, summary);
        }
        logPairs(details);
    }

    public void logError(String errorMessage, Throwable ex) {
        logger.error("{} {} ✖ {} [{}] ({}ms) - {}", service.getEmoji(), service.getDisplayName(),
                operation, callId, getElapsedMs(), errorMessage);
        if (ex != null) {
            logger.debug("  Error details:", ex);
        }
    }

    public String getCallId() {
        return callId;
    }

    public long getElapsedMs() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private void logPairs(Object... details) {
        if (details == null || !logger.isDebugEnabled()) {
            return;
        }
        for (int i = 0; i + 1 < details.length; i += 2) {
            logger.debug("  {}: {}", details[i], details[i + 1]);
        }
    }
}
