package com.purchasingpower.coderag.session.impl;

import com.purchasingpower.coderag.configuration.CodeRagProperties;
import com.purchasingpower.coderag.session.SessionManager;
import com.purchasingpower.coderag.session.SessionStats;
import com.purchasingpower.coderag.session.SessionStore;
import com.purchasingpower.coderag.session.SessionStoreFactory;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Access-ordered session registry. Overflow is evicted on the indexing pool so the
 * caller that pushed the registry over capacity is not slowed down by closing
 * another session. Closing waits for in-flight searches on that session, whose
 * legs run on the retrieval pool.
 */
@Slf4j
@Service
public class LruSessionManager implements SessionManager {

    private final SessionStoreFactory storeFactory;
    private final int maxCount;
    private final Executor executor;
    private final Clock clock;

    private final LinkedHashMap<String, Entry> sessions = new LinkedHashMap<>(16, 0.75f, true);

    @Autowired
    public LruSessionManager(SessionStoreFactory storeFactory,
                             CodeRagProperties properties,
                             @Qualifier("indexingExecutor") Executor executor) {
        this(storeFactory, properties.getSession().getMaxCount(), executor, Clock.systemUTC());
    }

    public LruSessionManager(SessionStoreFactory storeFactory, int maxCount, Executor executor, Clock clock) {
        this.storeFactory = storeFactory;
        this.maxCount = maxCount;
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public SessionStore getOrCreate(String sessionId) {
        boolean overflow;
        SessionStore store;
        synchronized (sessions) {
            Entry entry = sessions.get(sessionId);
            if (entry != null) {
                entry.lastAccess = clock.instant();
                return entry.store;
            }
            store = storeFactory.create(sessionId);
            sessions.put(sessionId, new Entry(store, clock.instant()));
            overflow = sessions.size() > maxCount;
            log.info("📦 Session created: {} (total: {})", sessionId, sessions.size());
        }
        if (overflow) {
            executor.execute(this::evictOverflow);
        }
        return store;
    }

    void evictOverflow() {
        List<Map.Entry<String, Entry>> evicted = new ArrayList<>();
        synchronized (sessions) {
            Iterator<Map.Entry<String, Entry>> eldest = sessions.entrySet().iterator();
            while (sessions.size() > maxCount && eldest.hasNext()) {
                Map.Entry<String, Entry> next = eldest.next();
                evicted.add(Map.entry(next.getKey(), next.getValue()));
                eldest.remove();
            }
        }
        for (Map.Entry<String, Entry> entry : evicted) {
            closeQuietly(entry.getKey(), entry.getValue().store);
            log.info("🗑️ LRU evicted: {}", entry.getKey());
        }
    }

    @Override
    public void close(String sessionId) {
        Entry entry;
        synchronized (sessions) {
            entry = sessions.remove(sessionId);
        }
        if (entry != null) {
            closeQuietly(sessionId, entry.store);
            log.info("🔒 Session closed: {}", sessionId);
        }
    }

    @Override
    @PreDestroy
    public void closeAll() {
        List<Map.Entry<String, Entry>> all;
        synchronized (sessions) {
            all = new ArrayList<>(sessions.entrySet());
            sessions.clear();
        }
        all.forEach(entry -> closeQuietly(entry.getKey(), entry.getValue().store));
        log.info("🔒 All sessions closed ({})", all.size());
    }

    @Override
    public int size() {
        synchronized (sessions) {
            return sessions.size();
        }
    }

    @Override
    public SessionStats stats() {
        Instant now = clock.instant();
        List<SessionStats.SessionInfo> infos = new ArrayList<>();
        int total;
        synchronized (sessions) {
            total = sessions.size();
            // Iterating an access-ordered map through entrySet does not reorder it
            for (Map.Entry<String, Entry> entry : sessions.entrySet()) {
                Entry value = entry.getValue();
                infos.add(new SessionStats.SessionInfo(entry.getKey(),
                        round(Duration.between(value.createdAt, now).toMillis() / 3_600_000.0),
                        round(Duration.between(value.lastAccess, now).toMillis() / 60_000.0)));
            }
        }
        infos.sort(Comparator.comparingDouble(SessionStats.SessionInfo::getIdleMinutes).reversed());
        return SessionStats.builder()
                .totalSessions(total)
                .maxSessions(maxCount)
                .sessions(infos)
                .build();
    }

    private static void closeQuietly(String sessionId, SessionStore store) {
        try {
            store.close();
        } catch (RuntimeException e) {
            log.error("❌ Failed to close session {}: {}", sessionId, e.getMessage(), e);
        }
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static final class Entry {
        final SessionStore store;
        final Instant createdAt;
        volatile Instant lastAccess;

        Entry(SessionStore store, Instant createdAt) {
            this.store = store;
            this.createdAt = createdAt;
            this.lastAccess = createdAt;
        }
    }
}
