package com.purchasingpower.coderag.indexing.impl;

import com.purchasingpower.coderag.chunking.Chunker;
import com.purchasingpower.coderag.configuration.CodeRagProperties;
import com.purchasingpower.coderag.core.Chunk;
import com.purchasingpower.coderag.exception.LockTimeoutException;
import com.purchasingpower.coderag.indexing.IndexingResult;
import com.purchasingpower.coderag.indexing.IndexingState;
import com.purchasingpower.coderag.indexing.IndexingStatus;
import com.purchasingpower.coderag.indexing.RepositoryIndexingService;
import com.purchasingpower.coderag.indexing.SourceFile;
import com.purchasingpower.coderag.lock.LockGuard;
import com.purchasingpower.coderag.lock.RepoLock;
import com.purchasingpower.coderag.session.SessionManager;
import com.purchasingpower.coderag.session.SessionStore;
import com.purchasingpower.coderag.util.SessionIds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Orchestrates a full repository index: lock, reset, chunk, embed and store, context.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class DefaultRepositoryIndexingService implements RepositoryIndexingService {

    private final SessionManager sessionManager;
    private final RepoLock repoLock;
    private final Chunker chunker;
    private final Executor executor;
    private final Duration acquireTimeout;

    private final Map<String, IndexingStatus> statuses = new ConcurrentHashMap<>();

    public DefaultRepositoryIndexingService(SessionManager sessionManager,
                                            RepoLock repoLock,
                                            Chunker chunker,
                                            CodeRagProperties properties,
                                            @Qualifier("retrievalExecutor") Executor executor) {
        this.sessionManager = sessionManager;
        this.repoLock = repoLock;
        this.chunker = chunker;
        this.executor = executor;
        this.acquireTimeout = Duration.ofSeconds(properties.getLock().getAcquireTimeoutSeconds());
    }

    @Override
    public IndexingResult indexRepository(String repoUrl, List<SourceFile> files, Map<String, Object> globalContext) {
        long startTime = System.currentTimeMillis();
        String sessionId = SessionIds.forRepository(repoUrl);

        log.info("Starting indexing for repository: {} ({} files)", sessionId, files.size());
        updateStatus(sessionId, IndexingState.WAITING_FOR_LOCK, 0, "Waiting for repository lock");

        try (LockGuard ignored = repoLock.acquire(sessionId, acquireTimeout)) {
            SessionStore store = sessionManager.getOrCreate(sessionId);

            updateStatus(sessionId, IndexingState.RESETTING, 5, "Clearing previous index");
            store.reset();

            updateStatus(sessionId, IndexingState.CHUNKING, 20, "Chunking source files");
            List<String> errors = new ArrayList<>();
            List<Chunk> chunks = chunkAll(files, errors);
            log.info("📦 Chunked {} files into {} chunks", files.size(), chunks.size());

            updateStatus(sessionId, IndexingState.EMBEDDING, 50, "Embedding and storing chunks");
            int indexed = store.indexChunks(chunks);

            store.saveContext(SessionIds.normalizeRepoUrl(repoUrl), globalContext);
            updateStatus(sessionId, IndexingState.COMPLETED, 100, "Indexing completed");

            long duration = System.currentTimeMillis() - startTime;
            log.info("✅ Indexing completed for {}: {} chunks, {} documents in {}ms",
                    sessionId, chunks.size(), indexed, duration);

            return IndexingResult.builder()
                    .success(true)
                    .sessionId(sessionId)
                    .filesProcessed(files.size())
                    .chunksCreated(chunks.size())
                    .documentsIndexed(indexed)
                    .durationMs(duration)
                    .errors(errors)
                    .build();

        } catch (LockTimeoutException e) {
            updateStatus(sessionId, IndexingState.FAILED, 0, "Repository busy");
            throw e;
        } catch (RuntimeException e) {
            log.error("❌ Indexing failed for repository {}: {}", sessionId, e.getMessage(), e);
            updateStatus(sessionId, IndexingState.FAILED, 0, "Failed: " + e.getMessage());
            return IndexingResult.failure(sessionId, e.getMessage(), System.currentTimeMillis() - startTime);
        }
    }

    @Override
    @Async("indexingExecutor")
    public CompletableFuture<IndexingResult> indexRepositoryAsync(String repoUrl, List<SourceFile> files,
                                                                  Map<String, Object> globalContext) {
        return CompletableFuture.completedFuture(indexRepository(repoUrl, files, globalContext));
    }

    @Override
    public IndexingStatus getIndexingStatus(String sessionId) {
        return statuses.getOrDefault(sessionId, IndexingStatus.notStarted(sessionId));
    }

    /**
     * Chunks files in parallel; results keep the input file order.
     */
    private List<Chunk> chunkAll(List<SourceFile> files, List<String> errors) {
        List<CompletableFuture<List<Chunk>>> futures = new ArrayList<>(files.size());
        for (SourceFile file : files) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> chunker.chunk(file.getContent(), file.getPath()), executor));
        }

        List<Chunk> chunks = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                chunks.addAll(futures.get(i).join());
            } catch (RuntimeException e) {
                String path = files.get(i).getPath();
                log.warn("⚠️ Skipping {}: {}", path, e.getMessage());
                errors.add(path + ": " + e.getMessage());
            }
        }
        return chunks;
    }

    private void updateStatus(String sessionId, IndexingState state, int progress, String step) {
        statuses.put(sessionId, IndexingStatus.builder()
                .sessionId(sessionId)
                .state(state)
                .progress(progress)
                .currentStep(step)
                .updatedAt(System.currentTimeMillis())
                .build());
    }
}
