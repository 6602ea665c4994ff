package com.purchasingpower.coderag.chunking.outline;

import java.util.ArrayList;
import java.util.List;

/**
 * Line index over a file's text. Lines and columns are 1-based.
 */
public final class SourceText {

    private final String content;
    private final int[] lineStarts;

    public SourceText(String content) {
        this.content = content;
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    public String getContent() {
        return content;
    }

    public int lineCount() {
        return lineStarts.length;
    }

    public int lineStart(int line) {
        return lineStarts[line - 1];
    }

    /**
     * Offset just past the last character of the line, excluding its newline.
     */
    public int lineEnd(int line) {
        if (line >= lineStarts.length) {
            return content.length();
        }
        return lineStarts[line] - 1;
    }

    public String line(int line) {
        return content.substring(lineStart(line), lineEnd(line));
    }

    /**
     * Whole lines {@code from..to}, inclusive, joined by their original newlines.
     */
    public String lines(int from, int to) {
        return content.substring(lineStart(from), lineEnd(to));
    }

    public int offset(int line, int column) {
        return Math.min(lineStart(line) + column - 1, content.length());
    }

    /**
     * 1-based line containing the given offset.
     */
    public int lineAt(int offset) {
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low + 1;
    }

    /**
     * Text between two positions, both inclusive. When only whitespace precedes
     * the start on its line, the slice starts at the beginning of the line so
     * indentation is kept.
     */
    public String slice(int beginLine, int beginColumn, int endLine, int endColumn) {
        int start = offset(beginLine, beginColumn);
        int lineStart = lineStart(beginLine);
        if (content.substring(lineStart, start).isBlank()) {
            start = lineStart;
        }
        int end = Math.min(offset(endLine, endColumn) + 1, content.length());
        return content.substring(start, end);
    }
}
