package com.purchasingpower.coderag.indexing;

public enum IndexingState {
    NOT_STARTED,
    WAITING_FOR_LOCK,
    RESETTING,
    CHUNKING,
    EMBEDDING,
    COMPLETED,
    FAILED
}
