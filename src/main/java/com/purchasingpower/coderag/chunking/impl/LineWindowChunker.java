package com.purchasingpower.coderag.chunking.impl;

import com.purchasingpower.coderag.core.Chunk;
import com.purchasingpower.coderag.core.ChunkKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-size line windows, the last resort for text that has no usable structure.
 *
 * <p>A window holds at most {@code windowLines} lines and at most {@code maxChars}
 * characters. A single line longer than {@code maxChars} is cut into pieces.
 * Whitespace-only windows are skipped.
 */
public class LineWindowChunker {

    private final int windowLines;
    private final int maxChars;

    public LineWindowChunker(int windowLines, int maxChars) {
        this.windowLines = windowLines;
        this.maxChars = maxChars;
    }

    /**
     * Windows over a whole file, named {@code chunk_<zero-based line>}.
     */
    public List<Chunk> chunk(String content, String filePath) {
        List<Chunk> chunks = new ArrayList<>();
        for (Window window : windows(content)) {
            chunks.add(Chunk.builder()
                    .content(window.text)
                    .filePath(filePath)
                    .kind(ChunkKind.TEXT_BLOCK)
                    .symbolName("chunk_" + window.lineOffset)
                    .startLine(window.lineOffset + 1)
                    .build());
        }
        return chunks;
    }

    /**
     * Windows over one oversized declaration, each carrying the same context header.
     */
    public List<Chunk> split(String code, String header, String filePath, int firstLine,
                             ChunkKind kind, String symbol, String enclosingType) {
        List<Chunk> chunks = new ArrayList<>();
        for (Window window : windows(code)) {
            chunks.add(Chunk.builder()
                    .content(header + window.text)
                    .headerLength(header.length())
                    .filePath(filePath)
                    .kind(kind)
                    .symbolName(symbol)
                    .startLine(firstLine + window.lineOffset)
                    .enclosingType(enclosingType)
                    .build());
        }
        return chunks;
    }

    private List<Window> windows(String text) {
        String[] lines = text.split("\n", -1);
        List<Window> windows = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int currentStart = 0;
        int count = 0;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.length() > maxChars) {
                flush(windows, current, currentStart, count);
                current.setLength(0);
                count = 0;
                for (int from = 0; from < line.length(); from += maxChars) {
                    addWindow(windows, line.substring(from, Math.min(from + maxChars, line.length())), i);
                }
                continue;
            }
            if (count > 0 && (count >= windowLines || current.length() + 1 + line.length() > maxChars)) {
                flush(windows, current, currentStart, count);
                current.setLength(0);
                count = 0;
            }
            if (count == 0) {
                currentStart = i;
            } else {
                current.append('\n');
            }
            current.append(line);
            count++;
        }
        flush(windows, current, currentStart, count);
        return windows;
    }

    private static void flush(List<Window> windows, StringBuilder current, int start, int count) {
        if (count > 0) {
            addWindow(windows, current.toString(), start);
        }
    }

    private static void addWindow(List<Window> windows, String text, int lineOffset) {
        if (!text.isBlank()) {
            windows.add(new Window(text, lineOffset));
        }
    }

    private static final class Window {
        final String text;
        final int lineOffset;

        Window(String text, int lineOffset) {
            this.text = text;
            this.lineOffset = lineOffset;
        }
    }
}
