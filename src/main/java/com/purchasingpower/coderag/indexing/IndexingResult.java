package com.purchasingpower.coderag.indexing;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one full indexing run. Files that could not be chunked are listed in
 * {@code errors} without failing the run.
 */
@Value
@Builder
public class IndexingResult {

    boolean success;

    String sessionId;

    int filesProcessed;

    int chunksCreated;

    int documentsIndexed;

    long durationMs;

    @Singular
    List<String> errors;

    public static IndexingResult failure(String sessionId, String error, long durationMs) {
        return IndexingResult.builder()
                .success(false)
                .sessionId(sessionId)
                .error(error)
                .durationMs(durationMs)
                .build();
    }
}
