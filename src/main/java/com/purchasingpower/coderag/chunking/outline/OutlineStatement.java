package com.purchasingpower.coderag.chunking.outline;

import lombok.Value;

/**
 * A non-declaration top-level statement (an import or another global).
 */
@Value
public class OutlineStatement {

    String text;

    int line;
}
