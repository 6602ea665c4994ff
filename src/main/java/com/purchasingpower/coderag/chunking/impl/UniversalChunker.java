package com.purchasingpower.coderag.chunking.impl;

import com.purchasingpower.coderag.chunking.Chunker;
import com.purchasingpower.coderag.chunking.ChunkingStrategy;
import com.purchasingpower.coderag.chunking.outline.JavaOutlineParser;
import com.purchasingpower.coderag.chunking.outline.OutlineParser;
import com.purchasingpower.coderag.chunking.outline.PythonOutlineParser;
import com.purchasingpower.coderag.chunking.outline.SourceOutline;
import com.purchasingpower.coderag.configuration.ChunkerProperties;
import com.purchasingpower.coderag.core.Chunk;
import com.purchasingpower.coderag.core.ChunkKind;
import com.purchasingpower.coderag.exception.SourceParseException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Language-aware chunker: picks a {@link ChunkingStrategy} from the file extension
 * and falls back to line windows when the file cannot be parsed.
 *
 * <p>Line endings are normalized to {@code \n} before chunking.
 */
@Slf4j
public class UniversalChunker implements Chunker {

    private final ChunkerProperties properties;
    private final LineWindowChunker windows;
    private final DeclarativeChunker declarative;
    private final BraceDelimitedChunker braceDelimited;
    private final Map<String, OutlineParser> outlineParsers;

    public UniversalChunker(ChunkerProperties properties) {
        this.properties = properties;
        this.windows = new LineWindowChunker(properties.getFallbackWindowLines(), properties.getMaxChunkSize());
        this.declarative = new DeclarativeChunker(properties, windows);
        this.braceDelimited = new BraceDelimitedChunker(properties, windows);
        this.outlineParsers = Map.of(
                "py", new PythonOutlineParser(),
                "java", new JavaOutlineParser());
    }

    @Override
    public List<Chunk> chunk(String content, String filePath) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        String text = content.replace("\r\n", "\n").replace('\r', '\n');
        ChunkingStrategy strategy = ChunkingStrategy.forPath(filePath);

        List<Chunk> chunks;
        try {
            chunks = switch (strategy) {
                case DECLARATIVE -> declarative(text, filePath);
                case BRACE_DELIMITED -> braceDelimited.chunk(text, filePath);
                case FALLBACK -> windows.chunk(text, filePath);
            };
        } catch (SourceParseException e) {
            log.debug("⚠️ {} - falling back to line windows", e.getMessage());
            chunks = windows.chunk(text, filePath);
        }

        List<Chunk> kept = dropSmallFunctions(chunks);
        log.debug("📦 Chunked {} ({}) into {} chunks", filePath, strategy, kept.size());
        return kept;
    }

    private List<Chunk> declarative(String text, String filePath) {
        OutlineParser parser = outlineParsers.get(ChunkingStrategy.extensionOf(filePath));
        SourceOutline outline = parser.parse(text, filePath);
        return declarative.chunk(outline, text, filePath);
    }

    /**
     * Top-level functions under the minimum size are dropped, but only when the file
     * has at least one chunk that meets it, so a tiny file never loses its only content.
     * Classes and the methods of split classes are always kept.
     */
    private List<Chunk> dropSmallFunctions(List<Chunk> chunks) {
        int min = properties.getMinChunkSize();
        boolean hasLargeChunk = chunks.stream().anyMatch(chunk -> chunk.getCode().length() >= min);
        if (!hasLargeChunk) {
            return chunks;
        }
        List<Chunk> kept = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            if (chunk.getKind() == ChunkKind.FUNCTION && chunk.getCode().length() < min) {
                continue;
            }
            kept.add(chunk);
        }
        return kept;
    }
}
