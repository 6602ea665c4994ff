package com.purchasingpower.coderag.chunking.impl;

import com.purchasingpower.coderag.chunking.outline.OutlineDeclaration;
import com.purchasingpower.coderag.chunking.outline.OutlineStatement;
import com.purchasingpower.coderag.chunking.outline.OutlineType;
import com.purchasingpower.coderag.chunking.outline.SourceOutline;
import com.purchasingpower.coderag.configuration.ChunkerProperties;
import com.purchasingpower.coderag.core.Chunk;
import com.purchasingpower.coderag.core.ChunkKind;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns a {@link SourceOutline} into chunks.
 *
 * <p>A type that fits the size bound is one CLASS chunk. A larger type is split
 * into one METHOD chunk per member, each prefixed with a stub of the type (its
 * header, docstring and field statements) so the method reads in context.
 * Nested types of a split type are handled the same way one level down.
 * Imports are always part of the context header; other module globals join it
 * while they stay under {@code maxContextSize} and otherwise become their own
 * GLOBAL_CONTEXT chunk.
 */
public class DeclarativeChunker {

    private static final String GLOBALS_SYMBOL = "module_globals";
    private static final String DEFAULT_INDENT = "    ";

    private final ChunkerProperties properties;
    private final LineWindowChunker windows;

    public DeclarativeChunker(ChunkerProperties properties, LineWindowChunker windows) {
        this.properties = properties;
        this.windows = windows;
    }

    public List<Chunk> chunk(SourceOutline outline, String content, String filePath) {
        if (outline.getDeclarations().isEmpty()) {
            return script(content, filePath);
        }

        List<Chunk> chunks = new ArrayList<>();
        String imports = join(outline.getImports());
        String globals = join(outline.getGlobals());

        StringBuilder header = new StringBuilder(imports);
        if (!globals.isBlank()) {
            if (globals.length() <= properties.getMaxContextSize()) {
                appendLine(header, globals);
            } else {
                int firstLine = outline.getGlobals().get(0).getLine();
                chunks.addAll(globalContext(globals, filePath, firstLine));
            }
        }
        String contextHeader = header.length() == 0 ? "" : header + "\n\n";

        for (OutlineDeclaration declaration : outline.getDeclarations()) {
            if (declaration instanceof OutlineType type) {
                chunks.addAll(type(type, contextHeader, filePath, null, outline.getCommentPrefix()));
            } else {
                chunks.addAll(member(declaration, contextHeader, filePath, ChunkKind.FUNCTION, null));
            }
        }
        return chunks;
    }

    private List<Chunk> type(OutlineType type, String header, String filePath, String enclosingType,
                             String commentPrefix) {
        if (type.getText().length() <= properties.getMaxChunkSize()) {
            return List.of(chunk(header, type.getText(), filePath, ChunkKind.CLASS,
                    type.getName(), type.getLine(), enclosingType));
        }
        if (type.getDeclarations().isEmpty()) {
            return windows.split(type.getText(), header, filePath, type.getFirstLine(),
                    ChunkKind.TEXT_BLOCK, type.getName(), enclosingType);
        }

        String memberHeader = header + stub(type, commentPrefix);
        List<Chunk> chunks = new ArrayList<>();
        for (OutlineDeclaration declaration : type.getDeclarations()) {
            if (declaration instanceof OutlineType nested) {
                chunks.addAll(type(nested, memberHeader, filePath, type.getName(), commentPrefix));
            } else {
                chunks.addAll(member(declaration, memberHeader, filePath, ChunkKind.METHOD, type.getName()));
            }
        }
        return chunks;
    }

    private List<Chunk> member(OutlineDeclaration member, String header, String filePath,
                               ChunkKind kind, String enclosingType) {
        if (member.getText().length() <= properties.getMaxChunkSize()) {
            return List.of(chunk(header, member.getText(), filePath, kind,
                    member.getName(), member.getLine(), enclosingType));
        }
        return windows.split(member.getText(), header, filePath, member.getFirstLine(),
                ChunkKind.TEXT_BLOCK, member.getName(), enclosingType);
    }

    /**
     * Header, docstring and fields of a type followed by an elided-body marker.
     */
    private static String stub(OutlineType type, String commentPrefix) {
        StringBuilder stub = new StringBuilder(type.getHeader());
        if (!type.getDocstring().isBlank()) {
            appendLine(stub, type.getDocstring());
        }
        for (String field : type.getFields()) {
            appendLine(stub, field);
        }
        String indent = memberIndent(type);
        appendLine(stub, indent + commentPrefix + " ...");
        return stub.append('\n').toString();
    }

    private List<Chunk> script(String content, String filePath) {
        double limit = properties.getMaxChunkSize() * properties.getScriptTolerance();
        if (content.length() > limit) {
            return windows.chunk(content, filePath);
        }
        return List.of(Chunk.builder()
                .content(content)
                .filePath(filePath)
                .kind(ChunkKind.SCRIPT)
                .symbolName(baseName(filePath))
                .startLine(1)
                .build());
    }

    private List<Chunk> globalContext(String globals, String filePath, int firstLine) {
        if (globals.length() <= properties.getMaxChunkSize()) {
            return List.of(chunk("", globals, filePath, ChunkKind.GLOBAL_CONTEXT,
                    GLOBALS_SYMBOL, firstLine, null));
        }
        return windows.split(globals, "", filePath, firstLine,
                ChunkKind.GLOBAL_CONTEXT, GLOBALS_SYMBOL, null);
    }

    private static Chunk chunk(String header, String code, String filePath, ChunkKind kind,
                               String symbol, int line, String enclosingType) {
        return Chunk.builder()
                .content(header + code)
                .headerLength(header.length())
                .filePath(filePath)
                .kind(kind)
                .symbolName(symbol)
                .startLine(line)
                .enclosingType(enclosingType)
                .build();
    }

    private static String memberIndent(OutlineType type) {
        for (OutlineDeclaration declaration : type.getDeclarations()) {
            String text = declaration.getText();
            int i = 0;
            while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
                i++;
            }
            if (i > 0) {
                return text.substring(0, i);
            }
        }
        return DEFAULT_INDENT;
    }

    private static String join(List<OutlineStatement> statements) {
        return statements.stream().map(OutlineStatement::getText).collect(Collectors.joining("\n"));
    }

    private static void appendLine(StringBuilder builder, String text) {
        if (builder.length() > 0) {
            builder.append('\n');
        }
        builder.append(text);
    }

    private static String baseName(String filePath) {
        int slash = Math.max(filePath.lastIndexOf('/'), filePath.lastIndexOf('\\'));
        String name = filePath.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
