package com.purchasingpower.coderag.core;

import lombok.Builder;
import lombok.Value;

import java.util.HashMap;
import java.util.Map;

/**
 * A self-contained span of source text ready for embedding.
 *
 * <p>Content may start with a synthesized context header (imports, class stub,
 * small module globals) so the chunk reads correctly without its file.
 * Chunks are transient: they are consumed once when a session indexes them.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class Chunk {

    String content;

    String filePath;

    ChunkKind kind;

    String symbolName;

    /**
     * 1-based line of the declaration keyword (or first line of the window).
     */
    int startLine;

    /**
     * Enclosing class name when this chunk is a member; {@code null} otherwise.
     */
    String enclosingType;

    /**
     * Characters of synthesized context at the start of {@link #content}.
     */
    int headerLength;

    /**
     * The chunk's own source text, without the synthesized context header.
     */
    public String getCode() {
        return content.substring(Math.min(headerLength, content.length()));
    }

    /**
     * Flattens this chunk into the string metadata stored with a {@link Document}.
     */
    public Map<String, String> toMetadata() {
        Map<String, String> flat = new HashMap<>();
        flat.put(Document.META_FILE, filePath);
        flat.put(Document.META_KIND, kind.getValue());
        flat.put(Document.META_SYMBOL, symbolName);
        flat.put(Document.META_START_LINE, String.valueOf(startLine));
        if (enclosingType != null && !enclosingType.isEmpty()) {
            flat.put(Document.META_ENCLOSING_TYPE, enclosingType);
        }
        return flat;
    }
}
