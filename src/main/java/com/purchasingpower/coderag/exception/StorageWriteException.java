package com.purchasingpower.coderag.exception;

import lombok.Getter;

/**
 * The durable document store rejected a write after local retries were exhausted.
 *
 * <p>Callers may retry the whole operation later.
 */
@Getter
public class StorageWriteException extends RuntimeException {

    private final String collection;
    private final int attempts;

    public StorageWriteException(String collection, int attempts, String message, Throwable cause) {
        super(message, cause);
        this.collection = collection;
        this.attempts = attempts;
    }
}
