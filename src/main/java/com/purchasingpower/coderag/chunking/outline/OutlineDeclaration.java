package com.purchasingpower.coderag.chunking.outline;

/**
 * A named declaration in a source outline: a type or a function.
 */
public interface OutlineDeclaration {

    String getName();

    /**
     * 1-based line of the declaration keyword.
     */
    int getLine();

    /**
     * 1-based line where {@link #getText()} begins.
     */
    int getFirstLine();

    /**
     * Full source text, including decorators, annotations and leading comments.
     */
    String getText();
}
