package com.purchasingpower.coderag.lock.impl;

import com.purchasingpower.coderag.exception.LockTimeoutException;
import com.purchasingpower.coderag.lock.LockGuard;
import com.purchasingpower.coderag.lock.RepoLock;
import com.purchasingpower.coderag.util.CallContext;
import com.purchasingpower.coderag.util.ServiceType;
import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.params.SetParams;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis lock for multi-node deployments: {@code SET repo_lock:<key> <token> NX PX <lease>}.
 *
 * <p>The lease bounds how long a crashed holder can block others. Release deletes
 * the key only while it still holds this holder's token, so an expired lock that
 * someone else re-acquired is left alone.
 */
@Slf4j
public class RedisRepoLock implements RepoLock, AutoCloseable {

    static final String KEY_PREFIX = "repo_lock:";

    static final String RELEASE_SCRIPT =
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('del', KEYS[1]) "
                    + "else return 0 end";

    private static final long POLL_MS = 100;

    private final JedisPool pool;
    private final Duration lease;

    public RedisRepoLock(JedisPool pool, Duration lease) {
        this.pool = pool;
        this.lease = lease;
    }

    @Override
    public LockGuard acquire(String key, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        CallContext ctx = CallContext.start(ServiceType.REDIS, "AcquireLock", log);
        ctx.logRequest(key);
        try {
            while (true) {
                Optional<LockGuard> guard = tryAcquire(key);
                if (guard.isPresent()) {
                    ctx.logResponse("acquired");
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
        log.warn("⏰ Redis lock wait timed out: {}", key);
        throw new LockTimeoutException(key, timeout);
    }

    @Override
    public Optional<LockGuard> tryAcquire(String key) {
        String redisKey = KEY_PREFIX + key;
        String token = UUID.randomUUID().toString();
        try (Jedis jedis = pool.getResource()) {
            String result = jedis.set(redisKey, token, SetParams.setParams().nx().px(lease.toMillis()));
            if (!"OK".equalsIgnoreCase(result)) {
                return Optional.empty();
            }
        }
        log.debug("🔒 Redis lock acquired: {}", key);
        return Optional.of(new ReleasingLockGuard(key, () -> release(key, redisKey, token)));
    }

    @Override
    public boolean isLocked(String key) {
        try (Jedis jedis = pool.getResource()) {
            return jedis.exists(KEY_PREFIX + key);
        }
    }

    private void release(String key, String redisKey, String token) {
        try (Jedis jedis = pool.getResource()) {
            Object deleted = jedis.eval(RELEASE_SCRIPT, List.of(redisKey), List.of(token));
            if (Long.valueOf(1L).equals(deleted)) {
                log.debug("🔓 Redis lock released: {}", key);
            } else {
                log.warn("⚠️ Redis lock {} expired before release", key);
            }
        } catch (RuntimeException e) {
            // The lease expires the key eventually
            log.error("❌ Could not release Redis lock {}: {}", key, e.getMessage());
        }
    }

    @Override
    public void close() {
        pool.close();
    }
}
