package com.purchasingpower.coderag.util;

import java.time.Duration;

/**
 * Out-of-process dependencies whose calls are traced by {@link CallContext}.
 * Each carries the latency above which a completed call is logged as slow.
 */
public enum ServiceType {
    EMBEDDING("🟣", "Embedding", Duration.ofSeconds(10)),
    NEO4J("🟢", "Neo4j", Duration.ofSeconds(2)),
    REDIS("🔴", "Redis", Duration.ofMillis(500)),
    FILESYSTEM("📁", "Filesystem", Duration.ofSeconds(1));

    private final String emoji;
    private final String displayName;
    private final Duration slowCall;

    ServiceType(String emoji, String displayName, Duration slowCall) {
        this.emoji = emoji;
        this.displayName = displayName;
        this.slowCall = slowCall;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Duration getSlowCall() {
        return slowCall;
    }
}
