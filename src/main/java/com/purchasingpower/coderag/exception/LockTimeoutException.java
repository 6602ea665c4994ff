package com.purchasingpower.coderag.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * A repository lock could not be acquired in time ("repository busy, try later").
 */
@Getter
public class LockTimeoutException extends RuntimeException {

    private final String key;
    private final Duration timeout;

    public LockTimeoutException(String key, Duration timeout) {
        super("Repository busy: could not acquire lock '" + key + "' within " + timeout.toMillis() + "ms");
        this.key = key;
        this.timeout = timeout;
    }
}
