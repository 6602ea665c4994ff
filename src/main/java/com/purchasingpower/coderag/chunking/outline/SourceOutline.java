package com.purchasingpower.coderag.chunking.outline;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Top-level structure of one file as seen by the declarative chunker.
 */
@Value
@Builder
public class SourceOutline {

    @Singular("importStatement")
    List<OutlineStatement> imports;

    @Singular("global")
    List<OutlineStatement> globals;

    /**
     * Top-level types and functions in source order.
     */
    @Singular("declaration")
    List<OutlineDeclaration> declarations;

    /**
     * Line comment introducer of the language, used for the "elided body" marker.
     */
    String commentPrefix;
}
