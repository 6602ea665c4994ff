package com.purchasingpower.coderag.chunking.outline;

import lombok.Value;

/**
 * A function or method, with its indentation preserved.
 */
@Value
public class OutlineMember implements OutlineDeclaration {

    String name;

    int line;

    int firstLine;

    String text;
}
