package com.purchasingpower.coderag.lock;

import java.time.Duration;
import java.util.Optional;

/**
 * Mutual exclusion per repository key.
 *
 * <p>Writers (reset and indexing) hold the lock for the whole write sequence;
 * searches never take it.
 * <pre>
 * try (LockGuard guard = repoLock.acquire(sessionId, Duration.ofSeconds(60))) {
 *     store.reset();
 *     store.indexChunks(chunks);
 * }
 * </pre>
 */
public interface RepoLock {

    /**
     * Blocks until the lock is held or the timeout passes.
     *
     * @throws com.purchasingpower.coderag.exception.LockTimeoutException when the timeout passes
     */
    LockGuard acquire(String key, Duration timeout);

    /**
     * Non-blocking attempt.
     *
     * @return the guard, or empty when someone else holds the lock
     */
    Optional<LockGuard> tryAcquire(String key);

    boolean isLocked(String key);
}
