package com.purchasingpower.coderag.chunking.impl;

import java.util.BitSet;
import java.util.Set;

/**
 * Blanks out everything in C-family source that must not count as structure.
 *
 * <p>String, character and template literals, line and block comments, and
 * preprocessor directives are replaced by spaces in a copy of the text. Newlines
 * are kept, so offsets and line numbers match the input. Only braces in the
 * masked copy drive block nesting.
 */
final class BraceLexer {

    private static final Set<String> SINGLE_QUOTE_STRINGS = Set.of(
            "js", "ts", "jsx", "tsx", "mjs", "cjs", "php", "dart");
    private static final Set<String> BACKTICK_TEMPLATES = Set.of(
            "js", "ts", "jsx", "tsx", "mjs", "cjs");
    private static final Set<String> BACKTICK_RAW_STRINGS = Set.of("go");
    private static final Set<String> PREPROCESSED = Set.of("c", "h", "cpp", "hpp", "cc", "cs");
    private static final Set<String> HASH_COMMENTS = Set.of("php");

    private BraceLexer() {
    }

    static Lexed lex(String content, String extension) {
        char[] masked = content.toCharArray();
        BitSet directiveLines = new BitSet();
        int length = content.length();
        int line = 1;
        boolean lineStart = true;
        int i = 0;

        while (i < length) {
            char c = content.charAt(i);

            if (c == '\n') {
                line++;
                lineStart = true;
                i++;
                continue;
            }
            if (lineStart && (c == ' ' || c == '\t' || c == '\r' || c == '\f')) {
                i++;
                continue;
            }
            boolean atLineStart = lineStart;
            lineStart = false;

            if (atLineStart && c == '#' && PREPROCESSED.contains(extension)) {
                int end = i;
                while (true) {
                    int newline = content.indexOf('\n', end);
                    if (newline < 0) {
                        end = length;
                        break;
                    }
                    directiveLines.set(line);
                    if (newline > 0 && content.charAt(newline - 1) == '\\') {
                        line++;
                        end = newline + 1;
                        continue;
                    }
                    end = newline;
                    break;
                }
                directiveLines.set(line);
                blank(masked, i, end);
                i = end;
                continue;
            }
            if (c == '/' && i + 1 < length && content.charAt(i + 1) == '/'
                    || c == '#' && HASH_COMMENTS.contains(extension)) {
                int end = content.indexOf('\n', i);
                end = end < 0 ? length : end;
                blank(masked, i, end);
                i = end;
                continue;
            }
            if (c == '/' && i + 1 < length && content.charAt(i + 1) == '*') {
                int end = content.indexOf("*/", i + 2);
                end = end < 0 ? length : end + 2;
                line += newlines(content, i, end);
                blank(masked, i, end);
                i = end;
                continue;
            }
            if (c == '"') {
                int end = content.startsWith("\"\"\"", i)
                        ? closeTriple(content, i + 3)
                        : closeQuoted(content, i + 1, '"');
                line += newlines(content, i, end);
                blank(masked, i, end);
                i = end;
                continue;
            }
            if (c == '\'') {
                int end = SINGLE_QUOTE_STRINGS.contains(extension)
                        ? closeQuoted(content, i + 1, '\'')
                        : closeCharLiteral(content, i);
                line += newlines(content, i, end);
                blank(masked, i, end);
                i = end;
                continue;
            }
            if (c == '`' && (BACKTICK_TEMPLATES.contains(extension) || BACKTICK_RAW_STRINGS.contains(extension))) {
                int end = BACKTICK_TEMPLATES.contains(extension)
                        ? closeTemplate(content, i + 1)
                        : closeRaw(content, i + 1);
                line += newlines(content, i, end);
                blank(masked, i, end);
                i = end;
                continue;
            }
            i++;
        }
        return new Lexed(new String(masked), directiveLines);
    }

    /**
     * End (exclusive) of a quoted literal that started just before {@code from}.
     * An unescaped newline ends an unterminated literal so one bad quote cannot
     * swallow the rest of the file.
     */
    private static int closeQuoted(String content, int from, char quote) {
        int i = from;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote) {
                return i + 1;
            } else if (c == '\n') {
                return i;
            } else {
                i++;
            }
        }
        return content.length();
    }

    private static int closeTriple(String content, int from) {
        int end = content.indexOf("\"\"\"", from);
        return end < 0 ? content.length() : end + 3;
    }

    /**
     * A character literal ({@code 'a'}, {@code '\n'}, {@code 'A'}) or, when the
     * quote does not close nearby, a lone quote such as a Rust lifetime.
     */
    private static int closeCharLiteral(String content, int start) {
        int i = start + 1;
        if (i < content.length() && content.charAt(i) == '\\') {
            int close = content.indexOf('\'', i + 2);
            int newline = content.indexOf('\n', i);
            if (close > 0 && (newline < 0 || close < newline) && close - start <= 12) {
                return close + 1;
            }
            return start + 1;
        }
        int next = i + Character.charCount(content.codePointAt(Math.min(i, content.length() - 1)));
        if (i < content.length() && next < content.length() && content.charAt(next) == '\'') {
            return next + 1;
        }
        return start + 1;
    }

    private static int closeRaw(String content, int from) {
        int end = content.indexOf('`', from);
        return end < 0 ? content.length() : end + 1;
    }

    /**
     * Template literal with {@code ${...}} substitutions, which may nest further templates.
     */
    private static int closeTemplate(String content, int from) {
        int i = from;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == '`') {
                return i + 1;
            } else if (c == '$' && i + 1 < content.length() && content.charAt(i + 1) == '{') {
                i = closeSubstitution(content, i + 2);
            } else {
                i++;
            }
        }
        return content.length();
    }

    private static int closeSubstitution(String content, int from) {
        int depth = 1;
        int i = from;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == '`') {
                i = closeTemplate(content, i + 1);
            } else if (c == '"' || c == '\'') {
                i = closeQuoted(content, i + 1, c);
            } else if (c == '{') {
                depth++;
                i++;
            } else if (c == '}') {
                depth--;
                i++;
                if (depth == 0) {
                    return i;
                }
            } else {
                i++;
            }
        }
        return content.length();
    }

    private static int newlines(String content, int from, int to) {
        int count = 0;
        for (int i = from; i < to; i++) {
            if (content.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    private static void blank(char[] masked, int from, int to) {
        for (int k = from; k < to; k++) {
            if (masked[k] != '\n') {
                masked[k] = ' ';
            }
        }
    }

    /**
     * Masked text plus the 1-based lines that belong to preprocessor directives.
     */
    static final class Lexed {
        final String masked;
        final BitSet directiveLines;

        Lexed(String masked, BitSet directiveLines) {
            this.masked = masked;
            this.directiveLines = directiveLines;
        }

        boolean isDirective(int line) {
            return directiveLines.get(line);
        }
    }
}
