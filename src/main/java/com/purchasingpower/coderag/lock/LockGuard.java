package com.purchasingpower.coderag.lock;

/**
 * A held repository lock. Closing it releases the lock; closing twice is a no-op.
 */
public interface LockGuard extends AutoCloseable {

    String getKey();

    @Override
    void close();
}
