package com.purchasingpower.coderag.exception;

import lombok.Getter;

/**
 * Lexical cache file could not be read back. Handled by rebuilding from the document store.
 */
@Getter
public class CacheCorruptionException extends RuntimeException {

    private final String cacheFile;

    public CacheCorruptionException(String cacheFile, Throwable cause) {
        super("Lexical cache is unreadable: " + cacheFile, cause);
        this.cacheFile = cacheFile;
    }
}
