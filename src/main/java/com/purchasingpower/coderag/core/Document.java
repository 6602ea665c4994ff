package com.purchasingpower.coderag.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Persisted, immutable unit owned by a document store.
 *
 * <p>Ids are stable within a session ({@code <file>_<ordinal>}). A document is
 * only removed when its whole session is reset.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Document {

    public static final String META_FILE = "file";
    public static final String META_KIND = "kind";
    public static final String META_SYMBOL = "symbol";
    public static final String META_ENCLOSING_TYPE = "enclosing_type";
    public static final String META_START_LINE = "start_line";

    String id;

    String content;

    @Builder.Default
    Map<String, String> metadata = Map.of();

    float[] embedding;

    @JsonIgnore
    public String getFilePath() {
        String file = metadata.get(META_FILE);
        return file != null ? file : "";
    }

    @JsonIgnore
    public int getStartLine() {
        String line = metadata.get(META_START_LINE);
        if (line == null || line.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(line.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    @JsonIgnore
    public ChunkKind getKind() {
        return ChunkKind.fromValue(metadata.get(META_KIND));
    }

    /**
     * Copy without the vector, used for the lexical cache and search results.
     */
    public Document withoutEmbedding() {
        return embedding == null ? this : toBuilder().embedding(null).build();
    }
}
