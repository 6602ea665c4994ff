package com.purchasingpower.coderag.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * Sizing of the retrieval pool and the separate indexing pool.
 */
@Data
public class WorkerPoolProperties {

    @Min(1)
    private int coreSize = 8;

    @Min(1)
    private int maxSize = 16;

    @Min(0)
    private int queueCapacity = 500;

    /** Concurrent async indexing jobs. */
    @Min(1)
    private int indexingThreads = 2;

    @Min(0)
    private int indexingQueueCapacity = 100;

    @Min(0)
    private int shutdownAwaitSeconds = 30;
}
