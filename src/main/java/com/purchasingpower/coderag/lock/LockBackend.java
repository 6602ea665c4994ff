package com.purchasingpower.coderag.lock;

/**
 * Where repository locks live. {@code in-process} only protects one JVM,
 * {@code file} protects processes on one host, {@code distributed} uses Redis.
 */
public enum LockBackend {
    IN_PROCESS,
    FILE,
    DISTRIBUTED
}
