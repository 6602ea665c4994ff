package com.purchasingpower.coderag.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Two thread pools with different roles.
 *
 * <p>{@code indexingExecutor} runs {@code @Async} indexing jobs and deferred session
 * eviction. Those jobs block on work they hand to {@code retrievalExecutor}.
 *
 * <p>{@code retrievalExecutor} only runs leaf tasks that never wait on other pool
 * tasks: search legs, per-file chunking, embedding batches and lexical rebuilds.
 * A saturated retrieval pool runs the task on the submitting thread instead of
 * rejecting it, so a burst of indexing cannot fail concurrent searches.
 */
@Slf4j
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    private final WorkerPoolProperties pool;

    public AsyncConfig(CodeRagProperties properties) {
        this.pool = properties.getWorkerPool();
    }

    @Bean(name = "retrievalExecutor")
    public ThreadPoolTaskExecutor retrievalExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pool.getCoreSize());
        executor.setMaxPoolSize(Math.max(pool.getCoreSize(), pool.getMaxSize()));
        executor.setQueueCapacity(pool.getQueueCapacity());
        executor.setThreadNamePrefix("retrieval-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(pool.getShutdownAwaitSeconds());
        executor.initialize();

        log.info("✅ Retrieval executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(), executor.getMaxPoolSize(), pool.getQueueCapacity());
        return executor;
    }

    @Bean(name = "indexingExecutor")
    @Override
    public ThreadPoolTaskExecutor getAsyncExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pool.getIndexingThreads());
        executor.setMaxPoolSize(pool.getIndexingThreads());
        executor.setQueueCapacity(pool.getIndexingQueueCapacity());
        executor.setThreadNamePrefix("indexing-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(pool.getShutdownAwaitSeconds());
        executor.initialize();

        log.info("✅ Indexing executor configured: threads={}, queue={}",
                pool.getIndexingThreads(), pool.getIndexingQueueCapacity());
        return executor;
    }
}
