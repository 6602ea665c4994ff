package com.purchasingpower.coderag.lock.impl;

import com.purchasingpower.coderag.exception.LockTimeoutException;
import com.purchasingpower.coderag.lock.LockGuard;
import com.purchasingpower.coderag.lock.RepoLock;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * One binary semaphore per key. Only protects writers inside this JVM.
 */
@Slf4j
public class InMemoryRepoLock implements RepoLock {

    private final Map<String, Semaphore> semaphores = new ConcurrentHashMap<>();

    @Override
    public LockGuard acquire(String key, Duration timeout) {
        Semaphore semaphore = semaphoreFor(key);
        try {
            if (!semaphore.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("⏰ Lock wait timed out: {}", key);
                throw new LockTimeoutException(key, timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockTimeoutException(key, timeout);
        }
        log.debug("🔒 Lock acquired: {}", key);
        return guard(key, semaphore);
    }

    @Override
    public Optional<LockGuard> tryAcquire(String key) {
        Semaphore semaphore = semaphoreFor(key);
        if (!semaphore.tryAcquire()) {
            return Optional.empty();
        }
        return Optional.of(guard(key, semaphore));
    }

    @Override
    public boolean isLocked(String key) {
        Semaphore semaphore = semaphores.get(key);
        return semaphore != null && semaphore.availablePermits() == 0;
    }

    private Semaphore semaphoreFor(String key) {
        return semaphores.computeIfAbsent(key, k -> new Semaphore(1));
    }

    private static LockGuard guard(String key, Semaphore semaphore) {
        return new ReleasingLockGuard(key, () -> {
            semaphore.release();
            log.debug("🔓 Lock released: {}", key);
        });
    }
}
