package com.purchasingpower.coderag.chunking.outline;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A class-like declaration broken into the parts needed to build member chunks.
 *
 * <p>{@code header} is the declaration line(s) up to and including the body
 * opener. {@code fields} are class-level statements that are neither members
 * nor nested types (docstrings excluded), kept with their indentation.
 */
@Value
@Builder
public class OutlineType implements OutlineDeclaration {

    String name;

    int line;

    int firstLine;

    String text;

    String header;

    @Builder.Default
    String docstring = "";

    @Singular("field")
    List<String> fields;

    /**
     * Members and nested types in source order.
     */
    @Singular("declaration")
    List<OutlineDeclaration> declarations;
}
