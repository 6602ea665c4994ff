package com.purchasingpower.coderag.util;

import com.purchasingpower.coderag.config.GlobalRetryConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Runs a blocking external call under a Reactor backoff retry.
 *
 * <p>Non-transient failures and the last transient failure are rethrown as-is
 * (checked exceptions wrapped in {@link RetryExhaustedException}).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetryExecutor {

    private final GlobalRetryConfig retryConfig;

    public <T> T execute(String operation, Callable<T> call) {
        return execute(operation, call, TransientErrors::isTransient);
    }

    public <T> T execute(String operation, Callable<T> call, Predicate<Throwable> retryable) {
        int maxAttempts = Math.max(1, retryConfig.getMaxAttempts());
        AtomicInteger attempts = new AtomicInteger();

        try {
            return Mono.fromCallable(() -> {
                        attempts.incrementAndGet();
                        return call.call();
                    })
                    .retryWhen(buildRetrySpec(operation, maxAttempts, retryable))
                    .block();
        } catch (RuntimeException e) {
            Throwable failure = Exceptions.unwrap(e);
            if (attempts.get() >= maxAttempts && maxAttempts > 1) {
                log.error("❌ {} failed after {} attempts: {}", operation, attempts.get(), failure.getMessage());
            }
            if (failure instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            if (failure instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new RetryExhaustedException(operation, attempts.get(), failure);
        }
    }

    private Retry buildRetrySpec(String operation, int maxAttempts, Predicate<Throwable> retryable) {
        return Retry.backoff(maxAttempts - 1, Duration.ofMillis(retryConfig.getBackoffMs()))
                .maxBackoff(Duration.ofMillis(Math.max(retryConfig.getBackoffMs(), retryConfig.getMaxBackoffMs())))
                .jitter(retryConfig.getJitter())
                .filter(retryable)
                .doBeforeRetry(signal -> log.warn("⚠️ {} failed (attempt {}/{}), retrying: {}",
                        operation, signal.totalRetries() + 1, maxAttempts, signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    /**
     * Wraps a checked failure that survived all attempts.
     */
    public static class RetryExhaustedException extends RuntimeException {

        private final int attempts;

        public RetryExhaustedException(String operation, int attempts, Throwable cause) {
            super(operation + " failed after " + attempts + " attempt(s): " + cause.getMessage(), cause);
            this.attempts = attempts;
        }

        public int getAttempts() {
            return attempts;
        }
    }
}
