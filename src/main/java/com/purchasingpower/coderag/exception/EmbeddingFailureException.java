package com.purchasingpower.coderag.exception;

import lombok.Getter;

/**
 * An embedding request failed after retries.
 *
 * <p>Raised inside the gateway only; the public gateway methods turn it into empty vectors.
 */
@Getter
public class EmbeddingFailureException extends RuntimeException {

    private final int textCount;

    public EmbeddingFailureException(String message, int textCount, Throwable cause) {
        super(message, cause);
        this.textCount = textCount;
    }
}
