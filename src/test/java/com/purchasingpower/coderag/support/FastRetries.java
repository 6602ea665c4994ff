package com.purchasingpower.coderag.support;

import com.purchasingpower.coderag.config.GlobalRetryConfig;
import com.purchasingpower.coderag.util.RetryExecutor;

/**
 * Retry executor with millisecond backoff and no jitter.
 */
public final class FastRetries {

    private FastRetries() {
    }

    public static RetryExecutor withAttempts(int maxAttempts) {
        GlobalRetryConfig config = new GlobalRetryConfig();
        config.setMaxAttempts(maxAttempts);
        config.setBackoffMs(1);
        config.setMaxBackoffMs(2);
        config.setJitter(0.0);
        return new RetryExecutor(config);
    }
}
