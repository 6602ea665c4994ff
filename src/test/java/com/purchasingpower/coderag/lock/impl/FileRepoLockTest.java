package com.purchasingpower.coderag.lock.impl;

import com.purchasingpower.coderag.exception.LockTimeoutException;
import com.purchasingpower.coderag.lock.LockGuard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("File Repo Lock Tests")
class FileRepoLockTest {

    @TempDir
    Path tempDir;

    private FileRepoLock lock;

    @BeforeEach
    void setUp() {
        lock = new FileRepoLock(tempDir.resolve("locks"));
    }

    @Test
    @DisplayName("Should create a sanitized lock file per key")
    void testLockPath_ShouldBeSanitized() {
        Path path = lock.lockPath("repo_1a2b/acme:widgets");

        assertEquals("repo_1a2b_acme_widgets.lock", path.getFileName().toString());
        assertEquals(tempDir.resolve("locks"), path.getParent());
    }

    @Test
    @DisplayName("Should block a second holder in the same JVM until released")
    void testAcquire_ShouldExcludeOtherThreads() {
        LockGuard guard = lock.acquire("repo_a", Duration.ofSeconds(1));
        assertTrue(Files.exists(lock.lockPath("repo_a")));
        assertTrue(lock.isLocked("repo_a"));

        assertThrows(LockTimeoutException.class, () -> lock.acquire("repo_a", Duration.ofMillis(150)));
        assertTrue(lock.tryAcquire("repo_a").isEmpty());

        guard.close();

        assertFalse(lock.isLocked("repo_a"));
        Optional<LockGuard> again = lock.tryAcquire("repo_a");
        assertTrue(again.isPresent());
        again.get().close();
    }

    @Test
    @DisplayName("Should see the file lock held by another lock instance")
    void testSecondInstance_ShouldSeeFileLock() {
        FileRepoLock other = new FileRepoLock(tempDir.resolve("locks"));

        try (LockGuard guard = lock.acquire("repo_shared", Duration.ofSeconds(1))) {
            assertTrue(other.isLocked("repo_shared"));
            assertTrue(other.tryAcquire("repo_shared").isEmpty());
            assertThrows(LockTimeoutException.class, () -> other.acquire("repo_shared", Duration.ofMillis(250)));
        }

        Optional<LockGuard> acquired = other.tryAcquire("repo_shared");
        assertTrue(acquired.isPresent());
        acquired.get().close();
    }

    @Test
    @DisplayName("Should report an unused key as unlocked")
    void testUnknownKey_ShouldBeUnlocked() {
        assertFalse(lock.isLocked("repo_never_used"));
    }
}
