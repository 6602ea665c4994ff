package com.purchasingpower.coderag.indexing;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Full (re-)index of one repository into its session.
 *
 * <p>Runs under the repository lock: reset the session, chunk every file on the
 * worker pool, embed and store the chunks, then record the session context.
 * Searches against the session keep working throughout and see either the old
 * or the new corpus as it grows.
 */
public interface RepositoryIndexingService {

    /**
     * @param globalContext caller-computed repository context (file tree, summary),
     *                      stored with the session
     * @throws com.purchasingpower.coderag.exception.LockTimeoutException when another
     *         writer holds the repository for longer than the acquire timeout
     */
    IndexingResult indexRepository(String repoUrl, List<SourceFile> files, Map<String, Object> globalContext);

    CompletableFuture<IndexingResult> indexRepositoryAsync(String repoUrl, List<SourceFile> files,
                                                           Map<String, Object> globalContext);

    IndexingStatus getIndexingStatus(String sessionId);
}
