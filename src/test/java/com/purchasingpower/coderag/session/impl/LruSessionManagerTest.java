package com.purchasingpower.coderag.session.impl;

import com.purchasingpower.coderag.session.SessionStats;
import com.purchasingpower.coderag.session.SessionStore;
import com.purchasingpower.coderag.session.SessionStoreFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("LRU Session Manager Tests")
class LruSessionManagerTest {

    @Mock
    private SessionStoreFactory storeFactory;

    private final Map<String, SessionStore> created = new HashMap<>();
    private MutableClock clock;
    private LruSessionManager manager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        lenient().when(storeFactory.create(anyString())).thenAnswer(invocation -> {
            String id = invocation.getArgument(0);
            SessionStore store = mock(SessionStore.class);
            created.put(id, store);
            return store;
        });
        manager = new LruSessionManager(storeFactory, 2, Runnable::run, clock);
    }

    @Test
    @DisplayName("Should return the same store for the same session id")
    void testGetOrCreate_ShouldReuseStore() {
        SessionStore first = manager.getOrCreate("repo_a");
        SessionStore second = manager.getOrCreate("repo_a");

        assertSame(first, second);
        verify(storeFactory, times(1)).create("repo_a");
        assertEquals(1, manager.size());
    }

    @Test
    @DisplayName("Should evict and close the least recently used session over capacity")
    void testOverflow_ShouldEvictLeastRecentlyUsed() {
        manager.getOrCreate("repo_a");
        manager.getOrCreate("repo_b");
        manager.getOrCreate("repo_a");

        manager.getOrCreate("repo_c");

        assertEquals(2, manager.size());
        verify(created.get("repo_b")).close();
        verify(created.get("repo_a"), never()).close();
        verify(created.get("repo_c"), never()).close();

        // repo_b is gone, so asking again builds a fresh store
        manager.getOrCreate("repo_b");
        verify(storeFactory, times(2)).create("repo_b");
    }

    @Test
    @DisplayName("Should close and forget a single session")
    void testClose_ShouldRemoveSession() {
        SessionStore store = manager.getOrCreate("repo_a");

        manager.close("repo_a");
        manager.close("repo_unknown");

        verify(store).close();
        assertEquals(0, manager.size());
    }

    @Test
    @DisplayName("Should close every session even when one fails to close")
    void testCloseAll_ShouldContinuePastFailures() {
        SessionStore failing = manager.getOrCreate("repo_a");
        SessionStore healthy = manager.getOrCreate("repo_b");
        doThrow(new IllegalStateException("disk gone")).when(failing).close();

        manager.closeAll();

        verify(failing).close();
        verify(healthy).close();
        assertEquals(0, manager.size());
    }

    @Test
    @DisplayName("Should report age and idle time, most idle first")
    void testStats_ShouldDescribeSessions() {
        manager.getOrCreate("repo_old");
        clock.advance(Duration.ofMinutes(90));
        manager.getOrCreate("repo_new");
        clock.advance(Duration.ofMinutes(30));

        SessionStats stats = manager.stats();

        assertEquals(2, stats.getTotalSessions());
        assertEquals(2, stats.getMaxSessions());
        SessionStats.SessionInfo oldest = stats.getSessions().get(0);
        assertEquals("repo_old", oldest.getSessionId());
        assertEquals(2.0, oldest.getAgeHours());
        assertEquals(120.0, oldest.getIdleMinutes());
        assertEquals(30.0, stats.getSessions().get(1).getIdleMinutes());
        assertEquals(0.5, stats.getSessions().get(1).getAgeHours());
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
