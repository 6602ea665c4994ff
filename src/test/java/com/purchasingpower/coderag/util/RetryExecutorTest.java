package com.purchasingpower.coderag.util;

import com.purchasingpower.coderag.config.GlobalRetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Retry Executor Tests")
class RetryExecutorTest {

    private RetryExecutor retryExecutor;
    private GlobalRetryConfig config;

    @BeforeEach
    void setUp() {
        config = new GlobalRetryConfig();
        config.setMaxAttempts(3);
        config.setBackoffMs(1);
        config.setMaxBackoffMs(4);
        config.setJitter(0.0);
        retryExecutor = new RetryExecutor(config);
    }

    @Test
    @DisplayName("Should retry transient failures until the call succeeds")
    void testTransientFailure_ShouldRetry() {
        AtomicInteger attempts = new AtomicInteger();

        String result = retryExecutor.execute("flaky call", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new ConnectException("Connection refused");
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, attempts.get());
    }

    @Test
    @DisplayName("Should fail immediately on a non-transient error")
    void testPermanentFailure_ShouldNotRetry() {
        AtomicInteger attempts = new AtomicInteger();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> retryExecutor.execute("bad input", () -> {
                    attempts.incrementAndGet();
                    throw new IllegalArgumentException("invalid model name");
                }));

        assertEquals("invalid model name", e.getMessage());
        assertEquals(1, attempts.get());
    }

    @Test
    @DisplayName("Should wrap a checked failure that survives every attempt")
    void testExhausted_ShouldWrapCheckedException() {
        AtomicInteger attempts = new AtomicInteger();

        RetryExecutor.RetryExhaustedException e = assertThrows(RetryExecutor.RetryExhaustedException.class,
                () -> retryExecutor.execute("always down", () -> {
                    attempts.incrementAndGet();
                    throw new IOException("socket closed");
                }));

        assertEquals(3, attempts.get());
        assertEquals(3, e.getAttempts());
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    @DisplayName("Should back off exponentially between attempts up to the cap")
    void testBackoff_ShouldDelayRetries() {
        // Given: 20ms then 40ms capped to 30ms
        config.setBackoffMs(20);
        config.setMaxBackoffMs(30);
        AtomicInteger attempts = new AtomicInteger();
        long start = System.nanoTime();

        // When
        assertThrows(IllegalStateException.class, () -> retryExecutor.execute("slow service", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("503 Service Unavailable");
        }));

        // Then
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertEquals(3, attempts.get());
        assertTrue(elapsedMs >= 50, "expected at least 50ms of backoff, was " + elapsedMs);
    }

    @Test
    @DisplayName("Should honour a custom retry predicate")
    void testCustomPredicate_ShouldControlRetries() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(IllegalArgumentException.class, () -> retryExecutor.execute("custom", () -> {
            attempts.incrementAndGet();
            throw new IllegalArgumentException("retry me");
        }, error -> error instanceof IllegalArgumentException));

        assertEquals(3, attempts.get());
    }

    @Test
    @DisplayName("Should make a single attempt when retries are disabled")
    void testSingleAttempt_ShouldNotRetry() {
        config.setMaxAttempts(1);
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(IllegalStateException.class, () -> retryExecutor.execute("once", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("timeout");
        }));

        assertEquals(1, attempts.get());
    }

    @Test
    @DisplayName("Should classify connection, timeout and rate-limit errors as transient")
    void testTransientErrors_ShouldClassify() {
        assertTrue(TransientErrors.isTransient(new IOException("broken pipe")));
        assertTrue(TransientErrors.isTransient(new RuntimeException("HTTP 429 Too Many Requests")));
        assertTrue(TransientErrors.isTransient(new IllegalStateException("wrapper", new TimeoutException())));
        assertFalse(TransientErrors.isTransient(new IllegalArgumentException("unknown label")));
        assertFalse(TransientErrors.isTransient(new RuntimeException((String) null)));
    }
}
