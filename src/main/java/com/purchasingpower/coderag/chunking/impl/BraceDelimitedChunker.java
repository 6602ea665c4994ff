package com.purchasingpower.coderag.chunking.impl;

import com.purchasingpower.coderag.chunking.ChunkingStrategy;
import com.purchasingpower.coderag.chunking.outline.SourceText;
import com.purchasingpower.coderag.configuration.ChunkerProperties;
import com.purchasingpower.coderag.core.Chunk;
import com.purchasingpower.coderag.core.ChunkKind;
import com.purchasingpower.coderag.exception.SourceParseException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Chunks C-family source by top-level brace blocks.
 *
 * <p>Each top-level {@code {...}} span, together with its signature (the text
 * back to the previous {@code ;}, {@code }} or directive, limited to the last
 * group of non-blank lines) is one chunk. Text outside blocks is global context,
 * ordered imports first, then macro and type definitions, then everything else.
 * A type block over the size bound is split into its member blocks, each carrying
 * a stub of the type; other oversized blocks are line-windowed.
 */
public class BraceDelimitedChunker {

    private static final Pattern TYPE_DECLARATION = Pattern.compile(
            "\\b(?:class|struct|interface|enum|record|type|trait|impl|union|namespace|object)\\s+"
                    + "(?:(?:class|struct)\\s+)?([A-Za-z_$][\\w$]*)");
    private static final Pattern CALL_LIKE = Pattern.compile("([A-Za-z_$][\\w$]*)\\s*\\(");
    private static final Pattern ASSIGNMENT = Pattern.compile(
            "\\b(?:const|let|var|val)\\s+([A-Za-z_$][\\w$]*)");
    private static final Pattern IMPORT_LIKE = Pattern.compile(
            "^(?:import|using|package|use|namespace|require|from|extern\\s+crate)\\b|\\brequire\\s*\\(");
    private static final Pattern RETURNS_TYPE = Pattern.compile("^\\s*\\**\\s*[A-Za-z_$][\\w$]*\\s*\\(");
    private static final Pattern DEFINITION_LIKE = Pattern.compile("^(?:typedef|type)\\b");
    private static final Set<String> NOT_A_NAME = Set.of(
            "if", "for", "while", "switch", "catch", "return", "sizeof",
            "function", "func", "fn", "foreach", "elseif", "typeof", "new", "synchronized", "lock", "using");

    private static final String ANONYMOUS = "anonymous_block";
    private static final String GLOBALS_SYMBOL = "file_globals";

    private final ChunkerProperties properties;
    private final LineWindowChunker windows;

    public BraceDelimitedChunker(ChunkerProperties properties, LineWindowChunker windows) {
        this.properties = properties;
        this.windows = windows;
    }

    public List<Chunk> chunk(String content, String filePath) {
        String extension = ChunkingStrategy.extensionOf(filePath);
        BraceLexer.Lexed lexed = BraceLexer.lex(content, extension);
        SourceText source = new SourceText(content);

        List<Block> blocks = blocks(content, lexed, source, 0, content.length(), filePath);
        if (blocks.isEmpty()) {
            return script(content, filePath);
        }

        List<Global> globals = globals(content, lexed, source, blocks, 0, content.length());
        List<Chunk> chunks = new ArrayList<>();
        String contextHeader = contextHeader(globals, filePath, chunks);

        for (Block block : blocks) {
            String code = content.substring(block.start, block.end);
            Symbol symbol = symbol(lexed.masked.substring(block.start, block.open));
            int line = source.lineAt(firstCodeOffset(lexed.masked, block.start, block.open));
            ChunkKind kind = symbol.type ? ChunkKind.CLASS : ChunkKind.FUNCTION;

            if (code.length() <= properties.getMaxChunkSize()) {
                chunks.add(chunk(contextHeader, code, filePath, kind, symbol.name, line, null));
            } else if (symbol.type) {
                chunks.addAll(members(content, lexed, source, block, symbol.name, contextHeader, filePath));
            } else {
                chunks.addAll(windows.split(code, contextHeader, filePath, source.lineAt(block.start),
                        ChunkKind.TEXT_BLOCK, symbol.name, null));
            }
        }
        return chunks;
    }

    /**
     * One chunk per member block of an oversized type, each prefixed with the type stub.
     */
    private List<Chunk> members(String content, BraceLexer.Lexed lexed, SourceText source, Block type,
                                String typeName, String contextHeader, String filePath) {
        int bodyStart = type.open + 1;
        int bodyEnd = type.close;
        List<Block> members = blocks(content, lexed, source, bodyStart, bodyEnd, filePath);
        if (members.isEmpty()) {
            return windows.split(content.substring(type.start, type.end), contextHeader, filePath,
                    source.lineAt(type.start), ChunkKind.TEXT_BLOCK, typeName, null);
        }

        String fields = globals(content, lexed, source, members, bodyStart, bodyEnd).stream()
                .map(global -> global.text)
                .collect(Collectors.joining("\n"));
        StringBuilder stub = new StringBuilder(content.substring(type.start, type.open + 1));
        if (!fields.isBlank() && fields.length() <= properties.getMaxContextSize()) {
            stub.append('\n').append(fields);
        }
        stub.append('\n').append(indentOf(content, source, members.get(0).start)).append("// ...\n");
        String memberHeader = contextHeader + stub;

        List<Chunk> chunks = new ArrayList<>();
        for (Block member : members) {
            String code = content.substring(member.start, member.end);
            Symbol symbol = symbol(lexed.masked.substring(member.start, member.open));
            int line = source.lineAt(firstCodeOffset(lexed.masked, member.start, member.open));
            if (code.length() <= properties.getMaxChunkSize()) {
                ChunkKind kind = symbol.type ? ChunkKind.CLASS : ChunkKind.METHOD;
                chunks.add(chunk(memberHeader, code, filePath, kind, symbol.name, line, typeName));
            } else {
                chunks.addAll(windows.split(code, memberHeader, filePath, source.lineAt(member.start),
                        ChunkKind.TEXT_BLOCK, symbol.name, typeName));
            }
        }
        return chunks;
    }

    /**
     * Blocks at brace depth zero within {@code [from, to)}, each widened to its signature.
     */
    private static List<Block> blocks(String content, BraceLexer.Lexed lexed, SourceText source,
                                      int from, int to, String filePath) {
        String masked = lexed.masked;
        List<Block> blocks = new ArrayList<>();
        int depth = 0;
        int open = -1;
        int previousEnd = from;

        for (int i = from; i < to; i++) {
            char c = masked.charAt(i);
            if (c == '{') {
                if (depth == 0) {
                    open = i;
                }
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth < 0) {
                    throw new SourceParseException(filePath, source.lineAt(i), "unmatched '}'");
                }
                if (depth == 0) {
                    int start = signatureStart(content, lexed, source, previousEnd, open);
                    int end = blockEnd(masked, i + 1, to);
                    blocks.add(new Block(start, open, i, end));
                    previousEnd = end;
                    i = end - 1;
                }
            }
        }
        if (depth > 0) {
            throw new SourceParseException(filePath, source.lineAt(open), "'{' was never closed");
        }
        return blocks;
    }

    private static int signatureStart(String content, BraceLexer.Lexed lexed, SourceText source,
                                      int boundary, int open) {
        String masked = lexed.masked;
        int start = boundary;
        for (int k = open - 1; k >= boundary; k--) {
            char c = masked.charAt(k);
            if (c == ';' || c == '}') {
                start = k + 1;
                break;
            }
            if (c == '\n' && lexed.isDirective(source.lineAt(k))) {
                start = k + 1;
                break;
            }
        }
        start = skipWhitespace(content, start, open);

        int openLine = source.lineAt(open);
        int firstLine = source.lineAt(start);
        for (int line = openLine - 1; line > firstLine; line--) {
            if (source.line(line).isBlank()) {
                start = skipWhitespace(content, source.lineStart(line + 1), open);
                break;
            }
        }

        int lineStart = source.lineStart(source.lineAt(start));
        if (lineStart >= boundary && content.substring(lineStart, start).isBlank()) {
            start = lineStart;
        }
        return start;
    }

    /**
     * Extends a block past its closing brace to the end of that line, unless
     * another block opens on it. Picks up {@code };}, {@code });} and trailing comments.
     */
    private static int blockEnd(String masked, int afterClose, int to) {
        int newline = masked.indexOf('\n', afterClose);
        int lineEnd = newline < 0 || newline > to ? to : newline;
        String rest = masked.substring(afterClose, lineEnd);
        return rest.indexOf('{') < 0 && rest.indexOf('}') < 0 ? lineEnd : afterClose;
    }

    /**
     * Statements outside the given blocks, in the order imports, definitions, other.
     */
    private static List<Global> globals(String content, BraceLexer.Lexed lexed, SourceText source,
                                        List<Block> blocks, int from, int to) {
        List<Global> globals = new ArrayList<>();
        int cursor = from;
        for (Block block : blocks) {
            collectGlobals(content, lexed, source, cursor, block.start, globals);
            cursor = block.end;
        }
        collectGlobals(content, lexed, source, cursor, to, globals);
        globals.sort(Comparator.comparingInt(global -> global.priority));
        return globals;
    }

    private static void collectGlobals(String content, BraceLexer.Lexed lexed, SourceText source,
                                       int from, int to, List<Global> globals) {
        if (from >= to || content.substring(from, to).isBlank()) {
            return;
        }
        int firstLine = source.lineAt(from);
        int lastLine = source.lineAt(Math.max(from, to - 1));
        StringBuilder statement = new StringBuilder();
        StringBuilder maskedStatement = new StringBuilder();
        int statementLine = firstLine;

        for (int line = firstLine; line <= lastLine; line++) {
            int lineFrom = Math.max(from, source.lineStart(line));
            int lineTo = Math.min(to, source.lineEnd(line));
            String text = content.substring(lineFrom, lineTo);
            String masked = lexed.masked.substring(lineFrom, lineTo);

            if (text.isBlank()) {
                flush(statement, maskedStatement, statementLine, false, globals);
                continue;
            }
            if (lexed.isDirective(line)) {
                boolean continued = !statement.isEmpty() && statement.toString().stripTrailing().endsWith("\\");
                if (!continued) {
                    flush(statement, maskedStatement, statementLine, false, globals);
                    statementLine = line;
                }
                append(statement, text);
                append(maskedStatement, masked);
                if (!text.stripTrailing().endsWith("\\")) {
                    flush(statement, maskedStatement, statementLine, true, globals);
                }
                continue;
            }
            if (statement.isEmpty()) {
                statementLine = line;
            }
            append(statement, text);
            append(maskedStatement, masked);
            String trimmed = masked.strip();
            if (trimmed.endsWith(";") || trimmed.endsWith("}")) {
                flush(statement, maskedStatement, statementLine, false, globals);
            }
        }
        flush(statement, maskedStatement, statementLine, false, globals);
    }

    private static void flush(StringBuilder statement, StringBuilder masked, int line,
                              boolean directive, List<Global> globals) {
        if (statement.isEmpty()) {
            return;
        }
        String text = statement.toString();
        globals.add(new Global(text, line, priority(text, masked.toString(), directive)));
        statement.setLength(0);
        masked.setLength(0);
    }

    private static int priority(String text, String masked, boolean directive) {
        if (directive) {
            String directiveText = text.strip();
            return directiveText.matches("(?s)^#\\s*(?:include|import|using)\\b.*") ? 0 : 1;
        }
        String key = masked.strip();
        if (IMPORT_LIKE.matcher(key).find()) {
            return 0;
        }
        if (DEFINITION_LIKE.matcher(key).find()) {
            return 1;
        }
        return 2;
    }

    /**
     * Builds the header injected into every block chunk. Imports always go in;
     * the other globals go in while they fit {@code maxContextSize}, otherwise
     * they are emitted as GLOBAL_CONTEXT chunks.
     */
    private String contextHeader(List<Global> globals, String filePath, List<Chunk> chunks) {
        String imports = globals.stream().filter(global -> global.priority == 0)
                .map(global -> global.text).collect(Collectors.joining("\n"));
        List<Global> others = globals.stream().filter(global -> global.priority > 0).collect(Collectors.toList());
        String rest = others.stream().map(global -> global.text).collect(Collectors.joining("\n"));

        StringBuilder header = new StringBuilder(imports);
        if (!rest.isBlank()) {
            if (rest.length() <= properties.getMaxContextSize()) {
                if (header.length() > 0) {
                    header.append('\n');
                }
                header.append(rest);
            } else {
                int line = others.get(0).line;
                if (rest.length() <= properties.getMaxChunkSize()) {
                    chunks.add(chunk("", rest, filePath, ChunkKind.GLOBAL_CONTEXT, GLOBALS_SYMBOL, line, null));
                } else {
                    chunks.addAll(windows.split(rest, "", filePath, line,
                            ChunkKind.GLOBAL_CONTEXT, GLOBALS_SYMBOL, null));
                }
            }
        }
        return header.length() == 0 ? "" : header + "\n\n";
    }

    private List<Chunk> script(String content, String filePath) {
        double limit = properties.getMaxChunkSize() * properties.getScriptTolerance();
        if (content.length() > limit) {
            return windows.chunk(content, filePath);
        }
        return List.of(chunk("", content, filePath, ChunkKind.SCRIPT, baseName(filePath), 1, null));
    }

    /**
     * Name for a block from its masked signature. Type declarations win; then the
     * first call-like identifier that is not a keyword or an annotation; then an
     * assigned variable name.
     */
    static Symbol symbol(String maskedSignature) {
        String signature = stripGenerics(maskedSignature);

        Matcher type = TYPE_DECLARATION.matcher(signature);
        if (type.find() && !RETURNS_TYPE.matcher(signature.substring(type.end())).find()) {
            return new Symbol(type.group(1), true);
        }
        Matcher call = CALL_LIKE.matcher(signature);
        while (call.find()) {
            String name = call.group(1);
            boolean annotation = call.start(1) > 0 && signature.charAt(call.start(1) - 1) == '@';
            if (!annotation && !NOT_A_NAME.contains(name)) {
                return new Symbol(name, false);
            }
        }
        Matcher assignment = ASSIGNMENT.matcher(signature);
        if (assignment.find()) {
            return new Symbol(assignment.group(1), false);
        }
        return new Symbol(ANONYMOUS, false);
    }

    private static String stripGenerics(String text) {
        StringBuilder out = new StringBuilder(text.length());
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean arrow = i > 0 && (text.charAt(i - 1) == '-' || text.charAt(i - 1) == '=');
            if (c == '<' && i + 1 < text.length() && text.charAt(i + 1) != '<' && text.charAt(i + 1) != '=') {
                depth++;
                continue;
            }
            if (c == '>' && depth > 0 && !arrow) {
                depth--;
                continue;
            }
            if (depth == 0) {
                out.append(c);
            }
        }
        return depth == 0 ? out.toString() : text;
    }

    private static int firstCodeOffset(String masked, int from, int to) {
        for (int i = from; i < to; i++) {
            if (!Character.isWhitespace(masked.charAt(i))) {
                return i;
            }
        }
        return from;
    }

    private static int skipWhitespace(String content, int from, int to) {
        int i = from;
        while (i < to && Character.isWhitespace(content.charAt(i))) {
            i++;
        }
        return i;
    }

    private static String indentOf(String content, SourceText source, int offset) {
        int lineStart = source.lineStart(source.lineAt(offset));
        int i = lineStart;
        while (i < content.length() && (content.charAt(i) == ' ' || content.charAt(i) == '\t')) {
            i++;
        }
        return i > lineStart ? content.substring(lineStart, i) : "    ";
    }

    private static void append(StringBuilder builder, String text) {
        if (!builder.isEmpty()) {
            builder.append('\n');
        }
        builder.append(text);
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

    private static String baseName(String filePath) {
        int slash = Math.max(filePath.lastIndexOf('/'), filePath.lastIndexOf('\\'));
        String name = filePath.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static final class Block {
        final int start;
        final int open;
        final int close;
        final int end;

        Block(int start, int open, int close, int end) {
            this.start = start;
            this.open = open;
            this.close = close;
            this.end = end;
        }
    }

    private static final class Global {
        final String text;
        final int line;
        final int priority;

        Global(String text, int line, int priority) {
            this.text = text;
            this.line = line;
            this.priority = priority;
        }
    }

    static final class Symbol {
        final String name;
        final boolean type;

        Symbol(String name, boolean type) {
            this.name = name;
            this.type = type;
        }
    }
}
