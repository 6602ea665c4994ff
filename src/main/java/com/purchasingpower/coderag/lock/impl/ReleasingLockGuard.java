package com.purchasingpower.coderag.lock.impl;

import com.purchasingpower.coderag.lock.LockGuard;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Guard that runs its release action exactly once.
 */
final class ReleasingLockGuard implements LockGuard {

    private final String key;
    private final Runnable release;
    private final AtomicBoolean released = new AtomicBoolean();

    ReleasingLockGuard(String key, Runnable release) {
        this.key = key;
        this.release = release;
    }

    @Override
    public String getKey() {
        return key;
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            release.run();
        }
    }
}
