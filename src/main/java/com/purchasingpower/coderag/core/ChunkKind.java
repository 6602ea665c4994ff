package com.purchasingpower.coderag.core;

import java.util.Arrays;

/**
 * Kind of retrievable unit produced by the chunker.
 *
 * <p>The lower-case value is what gets stored in document metadata
 * under the {@code kind} key.
 *
 * @since 1.0.0
 */
public enum ChunkKind {

    /**
     * Whole class (or struct/interface/enum) that fits the size bound.
     */
    CLASS("class"),

    /**
     * Top-level function.
     */
    FUNCTION("function"),

    /**
     * Method split out of an oversized class, prefixed by a class stub.
     */
    METHOD("method"),

    /**
     * File without any declarations.
     */
    SCRIPT("script"),

    /**
     * Module-level statements too large to inject into every chunk.
     */
    GLOBAL_CONTEXT("global_context"),

    /**
     * Fixed line window (fallback or oversized declaration).
     */
    TEXT_BLOCK("text_block");

    private final String value;

    ChunkKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ChunkKind fromValue(String value) {
        return Arrays.stream(values())
            .filter(kind -> kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value))
            .findFirst()
            .orElse(TEXT_BLOCK);
    }
}
