package com.purchasingpower.coderag.chunking.outline;

import com.purchasingpower.coderag.exception.SourceParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Indentation-based outline of a Python module.
 *
 * <p>The text is scanned once to find logical lines (bracket nesting, backslash
 * continuations and multi-line strings join physical lines). Statements are then
 * grouped by indentation. Decorators and contiguous comment lines directly above a
 * statement belong to it.
 *
 * <p>Rejected input (unterminated strings or brackets, stray closing brackets,
 * inconsistent indentation, a {@code def}/{@code class} without its colon) raises
 * {@link SourceParseException}.
 */
public class PythonOutlineParser implements OutlineParser {

    private static final Pattern CLASS_DEF = Pattern.compile(
            "^class\\s+([^\\W\\d]\\w*)", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern FUNCTION_DEF = Pattern.compile(
            "^(?:async\\s+)?def\\s+([^\\W\\d]\\w*)", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern IMPORT = Pattern.compile("^(?:import|from)\\b");
    private static final Pattern STRING_START = Pattern.compile("^[rRuUbBfF]{0,2}(\"|')");
    private static final Pattern CLAUSE = Pattern.compile("^(?:else|elif|except|finally)\\b");

    private static final int TAB_SIZE = 8;

    @Override
    public SourceOutline parse(String content, String filePath) {
        SourceText source = new SourceText(content);
        Scan scan = scan(content, source, filePath);
        List<LogicalLine> lines = logicalLines(source, scan);

        SourceOutline.SourceOutlineBuilder outline = SourceOutline.builder().commentPrefix("#");

        List<Statement> statements = statements(lines, 0, lines.size(), source, filePath);
        if (!statements.isEmpty() && lines.get(statements.get(0).keyIndex).indent != 0) {
            throw new SourceParseException(filePath, statements.get(0).keyLine, "unexpected indent");
        }

        for (Statement statement : statements) {
            LogicalLine key = lines.get(statement.keyIndex);
            String keyText = key.masked.strip();
            String text = source.lines(statement.startLine, statement.endLine);

            if (CLASS_DEF.matcher(keyText).find()) {
                outline.declaration(parseType(statement, lines, source, filePath));
            } else if (FUNCTION_DEF.matcher(keyText).find()) {
                outline.declaration(parseFunction(statement, lines, source, filePath));
            } else if (IMPORT.matcher(keyText).find()) {
                outline.importStatement(new OutlineStatement(text, statement.startLine));
            } else {
                outline.global(new OutlineStatement(text, statement.startLine));
            }
        }
        return outline.build();
    }

    private OutlineMember parseFunction(Statement statement, List<LogicalLine> lines,
                                        SourceText source, String filePath) {
        LogicalLine key = lines.get(statement.keyIndex);
        Matcher matcher = FUNCTION_DEF.matcher(key.masked.strip());
        if (!matcher.find()) {
            throw new SourceParseException(filePath, statement.keyLine, "invalid function definition");
        }
        headerColon(key, filePath);
        return new OutlineMember(matcher.group(1), statement.keyLine, statement.startLine,
                source.lines(statement.startLine, statement.endLine));
    }

    private OutlineType parseType(Statement statement, List<LogicalLine> lines,
                                  SourceText source, String filePath) {
        LogicalLine key = lines.get(statement.keyIndex);
        Matcher matcher = CLASS_DEF.matcher(key.masked.strip());
        if (!matcher.find()) {
            throw new SourceParseException(filePath, statement.keyLine, "invalid class definition");
        }
        OutlineType.OutlineTypeBuilder type = OutlineType.builder()
                .name(matcher.group(1))
                .line(statement.keyLine)
                .firstLine(statement.startLine)
                .text(source.lines(statement.startLine, statement.endLine));

        int colon = headerColon(key, filePath);
        boolean inlineBody = !key.masked.substring(colon + 1).isBlank();
        if (inlineBody) {
            int headerEnd = source.lineStart(key.first) + colon + 1;
            type.header(source.getContent().substring(source.lineStart(statement.startLine), headerEnd));
            return type.build();
        }
        type.header(source.lines(statement.startLine, key.last));

        List<Statement> body = statements(lines, statement.keyIndex + 1, statement.lastIndex + 1,
                source, filePath);
        for (int i = 0; i < body.size(); i++) {
            Statement member = body.get(i);
            LogicalLine memberKey = lines.get(member.keyIndex);
            if (memberKey.indent <= key.indent) {
                throw new SourceParseException(filePath, member.keyLine, "expected an indented block");
            }
            String memberText = source.lines(member.startLine, member.endLine);
            String keyText = memberKey.masked.strip();
            String originalKey = source.line(member.keyLine).strip();

            if (i == 0 && STRING_START.matcher(originalKey).find() && member.keyIndex == member.lastIndex) {
                type.docstring(memberText);
            } else if (CLASS_DEF.matcher(keyText).find()) {
                type.declaration(parseType(member, lines, source, filePath));
            } else if (FUNCTION_DEF.matcher(keyText).find()) {
                type.declaration(parseFunction(member, lines, source, filePath));
            } else {
                type.field(memberText);
            }
        }
        return type.build();
    }

    /**
     * Offset, within the key line's text, of the colon that ends a compound statement header.
     */
    private static int headerColon(LogicalLine key, String filePath) {
        int depth = 0;
        String masked = key.masked;
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == ':' && depth == 0) {
                return i;
            }
        }
        throw new SourceParseException(filePath, key.first, "expected ':'");
    }

    /**
     * Groups the code lines in {@code [from, to)} into statements of one block.
     */
    private static List<Statement> statements(List<LogicalLine> lines, int from, int to,
                                              SourceText source, String filePath) {
        List<Statement> statements = new ArrayList<>();
        int baseIndent = -1;
        Statement current = null;
        int decoratorStart = -1;
        int decoratorLine = -1;

        for (int i = from; i < to; i++) {
            LogicalLine line = lines.get(i);
            if (!line.code) {
                continue;
            }
            if (baseIndent < 0) {
                baseIndent = line.indent;
            }
            if (line.indent < baseIndent) {
                throw new SourceParseException(filePath, line.first,
                        "unindent does not match any outer indentation level");
            }
            if (line.indent > baseIndent) {
                if (current == null || decoratorStart >= 0) {
                    throw new SourceParseException(filePath, line.first, "unexpected indent");
                }
                current.lastIndex = i;
                current.endLine = line.last;
                continue;
            }

            String stripped = line.masked.strip();
            if (current != null && decoratorStart < 0 && CLAUSE.matcher(stripped).find()) {
                current.lastIndex = i;
                current.endLine = line.last;
                continue;
            }
            if (stripped.startsWith("@")) {
                if (decoratorStart < 0) {
                    decoratorStart = i;
                    decoratorLine = leadingCommentStart(lines, i, from);
                }
                current = null;
                continue;
            }

            current = new Statement();
            current.keyIndex = i;
            current.keyLine = line.first;
            current.lastIndex = i;
            current.endLine = line.last;
            current.startLine = decoratorStart >= 0 ? decoratorLine : leadingCommentStart(lines, i, from);
            decoratorStart = -1;
            statements.add(current);
        }

        if (decoratorStart >= 0) {
            throw new SourceParseException(filePath, lines.get(decoratorStart).first,
                    "decorator without a definition");
        }
        return statements;
    }

    /**
     * First physical line of the comment lines directly above logical line {@code index}.
     */
    private static int leadingCommentStart(List<LogicalLine> lines, int index, int from) {
        int start = lines.get(index).first;
        for (int i = index - 1; i >= from; i--) {
            LogicalLine previous = lines.get(i);
            if (previous.code || previous.blank) {
                break;
            }
            start = previous.first;
        }
        return start;
    }

    private static List<LogicalLine> logicalLines(SourceText source, Scan scan) {
        List<LogicalLine> lines = new ArrayList<>();
        LogicalLine current = null;
        for (int line = 1; line <= source.lineCount(); line++) {
            if (current != null && scan.continuation[line]) {
                current.last = line;
                continue;
            }
            String text = source.line(line);
            String stripped = text.strip();
            current = new LogicalLine();
            current.first = line;
            current.last = line;
            current.indent = indentOf(text);
            current.blank = stripped.isEmpty();
            current.code = !current.blank && !stripped.startsWith("#");
            lines.add(current);
        }
        for (LogicalLine line : lines) {
            line.masked = new String(scan.masked, source.lineStart(line.first),
                    source.lineEnd(line.last) - source.lineStart(line.first));
        }
        return lines;
    }

    private static int indentOf(String line) {
        int width = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c == '\f') {
                width = 0;
            } else {
                break;
            }
        }
        return width;
    }

    private static Scan scan(String content, SourceText source, String filePath) {
        int length = content.length();
        char[] masked = content.toCharArray();
        boolean[] continuation = new boolean[source.lineCount() + 2];
        int depth = 0;
        int openLine = 0;
        int line = 1;
        int i = 0;

        while (i < length) {
            char c = content.charAt(i);
            if (c == '\n') {
                line++;
                continuation[line] = depth > 0;
                i++;
            } else if (c == '#') {
                int end = content.indexOf('\n', i);
                end = end < 0 ? length : end;
                blank(masked, i, end);
                i = end;
            } else if (c == '\\') {
                if (i + 1 < length && content.charAt(i + 1) == '\n') {
                    line++;
                    continuation[line] = true;
                    i += 2;
                } else {
                    i++;
                }
            } else if (c == '"' || c == '\'') {
                int startLine = line;
                boolean triple = i + 2 < length && content.charAt(i + 1) == c && content.charAt(i + 2) == c;
                int j = triple ? i + 3 : i + 1;
                boolean closed = false;
                while (j < length) {
                    char d = content.charAt(j);
                    if (d == '\\') {
                        if (j + 1 < length && content.charAt(j + 1) == '\n') {
                            line++;
                            continuation[line] = true;
                        }
                        j += 2;
                    } else if (d == '\n') {
                        if (!triple) {
                            break;
                        }
                        line++;
                        continuation[line] = true;
                        j++;
                    } else if (d == c && (!triple || (j + 2 < length
                            && content.charAt(j + 1) == c && content.charAt(j + 2) == c))) {
                        j += triple ? 3 : 1;
                        closed = true;
                        break;
                    } else {
                        j++;
                    }
                }
                if (!closed) {
                    throw new SourceParseException(filePath, startLine, "unterminated string literal");
                }
                blank(masked, i, j);
                i = j;
            } else {
                if (c == '(' || c == '[' || c == '{') {
                    if (depth == 0) {
                        openLine = line;
                    }
                    depth++;
                } else if (c == ')' || c == ']' || c == '}') {
                    depth--;
                    if (depth < 0) {
                        throw new SourceParseException(filePath, line, "unmatched '" + c + "'");
                    }
                }
                i++;
            }
        }
        if (depth > 0) {
            throw new SourceParseException(filePath, openLine, "bracket was never closed");
        }
        return new Scan(masked, continuation);
    }

    private static void blank(char[] masked, int from, int to) {
        for (int k = from; k < to; k++) {
            if (masked[k] != '\n') {
                masked[k] = ' ';
            }
        }
    }

    private static final class Scan {
        final char[] masked;
        final boolean[] continuation;

        Scan(char[] masked, boolean[] continuation) {
            this.masked = masked;
            this.continuation = continuation;
        }
    }

    private static final class LogicalLine {
        int first;
        int last;
        int indent;
        boolean code;
        boolean blank;
        String masked;
    }

    private static final class Statement {
        int startLine;
        int keyLine;
        int keyIndex;
        int lastIndex;
        int endLine;
    }
}
