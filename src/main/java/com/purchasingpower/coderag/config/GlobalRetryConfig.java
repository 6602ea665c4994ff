package com.purchasingpower.coderag.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retry policy for transient failures of external services (embedding model,
 * graph store, Redis, store files).
 *
 * <p>Properties are loaded from the {@code app.retry} namespace:
 * <pre>
 * app:
 *   retry:
 *     max-attempts: 3
 *     backoff-ms: 500
 *     max-backoff-ms: 5000
 *     jitter: 0.5
 * </pre>
 *
 * <p>The delay doubles on each retry, starting at {@code backoff-ms} and capped
 * at {@code max-backoff-ms}, randomized by {@code jitter} (a fraction of the delay).
 *
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "app.retry")
@Data
public class GlobalRetryConfig {

    /**
     * Total attempts, including the first one.
     */
    private int maxAttempts = 3;

    private long backoffMs = 500;

    private long maxBackoffMs = 5000;

    /**
     * 0.0 to 1.0.
     */
    private double jitter = 0.5;
}
