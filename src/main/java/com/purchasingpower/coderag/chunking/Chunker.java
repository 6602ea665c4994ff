package com.purchasingpower.coderag.chunking;

import com.purchasingpower.coderag.core.Chunk;

import java.util.List;

/**
 * Splits one source file into self-contained, retrievable chunks.
 *
 * <p>Implementations are deterministic: the same content, path and settings
 * always produce the same chunks in the same order. Empty content yields an
 * empty list. Parse problems never escape; the file is line-windowed instead.
 */
public interface Chunker {

    List<Chunk> chunk(String content, String filePath);
}
