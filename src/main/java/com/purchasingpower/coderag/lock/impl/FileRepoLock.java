package com.purchasingpower.coderag.lock.impl;

import com.purchasingpower.coderag.exception.LockTimeoutException;
import com.purchasingpower.coderag.lock.LockGuard;
import com.purchasingpower.coderag.lock.RepoLock;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Advisory file lock on {@code <dir>/<key>.lock}, shared by all processes on one host.
 *
 * <p>Threads of this JVM first queue on an in-process semaphore for the key, since
 * the OS lock is held per process, not per thread. The file lock is then polled
 * every 100 ms until the deadline.
 */
@Slf4j
public class FileRepoLock implements RepoLock {

    private static final long POLL_MS = 100;

    private final Path directory;
    private final Map<String, Semaphore> semaphores = new ConcurrentHashMap<>();

    public FileRepoLock(Path directory) {
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create lock directory " + directory, e);
        }
    }

    @Override
    public LockGuard acquire(String key, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
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

        try {
            while (true) {
                Optional<LockGuard> guard = tryFileLock(key, semaphore);
                if (guard.isPresent()) {
                    log.debug("🔒 File lock acquired: {}", key);
                    return guard.get();
                }
                if (System.nanoTime() >= deadline) {
                    break;
                }
                Thread.sleep(POLL_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        semaphore.release();
        log.warn("⏰ File lock wait timed out: {}", key);
        throw new LockTimeoutException(key, timeout);
    }

    @Override
    public Optional<LockGuard> tryAcquire(String key) {
        Semaphore semaphore = semaphoreFor(key);
        if (!semaphore.tryAcquire()) {
            return Optional.empty();
        }
        Optional<LockGuard> guard = tryFileLock(key, semaphore);
        if (guard.isEmpty()) {
            semaphore.release();
        }
        return guard;
    }

    @Override
    public boolean isLocked(String key) {
        Semaphore semaphore = semaphores.get(key);
        if (semaphore != null && semaphore.availablePermits() == 0) {
            return true;
        }
        Path path = lockPath(key);
        if (!Files.exists(path)) {
            return false;
        }
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.WRITE)) {
            FileLock trial = channel.tryLock();
            if (trial == null) {
                return true;
            }
            trial.release();
            return false;
        } catch (OverlappingFileLockException e) {
            return true;
        } catch (IOException e) {
            log.debug("⚠️ Could not test lock file {}: {}", path, e.getMessage());
            return true;
        }
    }

    Path lockPath(String key) {
        return directory.resolve(key.replaceAll("[^a-zA-Z0-9_-]", "_") + ".lock");
    }

    /**
     * Caller holds the key's semaphore; the returned guard releases both locks.
     */
    private Optional<LockGuard> tryFileLock(String key, Semaphore semaphore) {
        Path path = lockPath(key);
        FileChannel channel = null;
        try {
            channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock = channel.tryLock();
            if (lock == null) {
                channel.close();
                return Optional.empty();
            }
            FileChannel held = channel;
            return Optional.of(new ReleasingLockGuard(key, () -> release(key, lock, held, semaphore)));
        } catch (IOException | OverlappingFileLockException e) {
            log.debug("File lock busy for {}: {}", key, e.getMessage());
            closeQuietly(channel);
            return Optional.empty();
        }
    }

    private void release(String key, FileLock lock, FileChannel channel, Semaphore semaphore) {
        try {
            lock.release();
        } catch (IOException e) {
            log.warn("⚠️ Could not release file lock {}: {}", key, e.getMessage());
        } finally {
            closeQuietly(channel);
            semaphore.release();
            log.debug("🔓 File lock released: {}", key);
        }
    }

    private Semaphore semaphoreFor(String key) {
        return semaphores.computeIfAbsent(key, k -> new Semaphore(1));
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Could not close lock channel: {}", e.getMessage());
        }
    }
}
