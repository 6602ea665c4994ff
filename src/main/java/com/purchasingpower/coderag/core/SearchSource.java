package com.purchasingpower.coderag.core;

/**
 * Which candidate list produced a search result.
 *
 * @since 1.0.0
 */
public enum SearchSource {
    VECTOR,
    LEXICAL,
    HYBRID
}
