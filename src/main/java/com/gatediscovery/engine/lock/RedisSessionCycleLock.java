package com.gatediscovery.engine.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Redis session lock for multi-instance deployments.
 *
 * - Acquire: SET key owner NX PX ttl
 * - Release: Lua script that deletes the key only if this owner still holds it
 * - A crashed holder's lock expires with the TTL
 *
 * The owner value is instance id plus thread id, matching the local lock's
 * "held by this thread" semantics.
 */
@Slf4j
public class RedisSessionCycleLock implements SessionCycleLock {

    private static final String UNLOCK_SCRIPT = """
            if redis.call('get', KEYS[1]) == ARGV[1] then
                return redis.call('del', KEYS[1])
            end
            return 0
            """;

    private static final long POLL_INTERVAL_MILLIS = 50;

    private final StringRedisTemplate redisTemplate;
    private final Duration lockTtl;
    private final String instanceId = UUID.randomUUID().toString();

    public RedisSessionCycleLock(StringRedisTemplate redisTemplate, Duration lockTtl) {
        this.redisTemplate = redisTemplate;
        this.lockTtl = lockTtl;
    }

    @Override
    public boolean tryAcquire(Long sessionId) {
        String lockKey = buildLockKey(sessionId);
        try {
            boolean acquired = Boolean.TRUE.equals(
                redisTemplate.opsForValue().setIfAbsent(lockKey, ownerToken(), lockTtl));
            if (acquired) {
                log.debug("[RedisLock] Lock acquired: key={}", lockKey);
            } else {
                log.debug("[RedisLock] Lock held elsewhere: key={}", lockKey);
            }
            return acquired;
        } catch (Exception e) {
            // Without Redis the cycle cannot prove exclusivity, so it does not run
            log.error("[RedisLock] Failed to acquire lock: key={}", lockKey, e);
            return false;
        }
    }

    @Override
    public boolean tryAcquire(Long sessionId, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            if (tryAcquire(sessionId)) {
                return true;
            }
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(POLL_INTERVAL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[RedisLock] Interrupted while waiting for session {}", sessionId);
                return false;
            }
        }
    }

    @Override
    public void release(Long sessionId) {
        String lockKey = buildLockKey(sessionId);
        try {
            Long released = redisTemplate.execute(
                new DefaultRedisScript<>(UNLOCK_SCRIPT, Long.class),
                List.of(lockKey),
                ownerToken());
            if (released == null || released == 0) {
                log.warn("[RedisLock] Lock was not held at release (expired?): key={}", lockKey);
            }
        } catch (Exception e) {
            // The TTL frees the key if the delete never reached Redis
            log.error("[RedisLock] Failed to release lock: key={}", lockKey, e);
        }
    }

    @Override
    public String getStrategyName() {
        return "redis";
    }

    private String ownerToken() {
        return instanceId + ":" + Thread.currentThread().getId();
    }

    private static String buildLockKey(Long sessionId) {
        return "gate-discovery:lock:{" + sessionId + "}";
    }
}
