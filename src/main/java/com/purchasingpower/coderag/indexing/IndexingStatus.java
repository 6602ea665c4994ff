package com.purchasingpower.coderag.indexing;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class IndexingStatus {

    String sessionId;

    IndexingState state;

    /**
     * 0-100.
     */
    int progress;

    String currentStep;

    long updatedAt;

    public static IndexingStatus notStarted(String sessionId) {
        return IndexingStatus.builder()
                .sessionId(sessionId)
                .state(IndexingState.NOT_STARTED)
                .currentStep("Not started")
                .updatedAt(System.currentTimeMillis())
                .build();
    }
}
