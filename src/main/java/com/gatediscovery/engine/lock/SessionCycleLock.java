package com.gatediscovery.engine.lock;

import java.time.Duration;

/**
 * Mutual exclusion of background cycles per venue session.
 *
 * Discovery, enforcement and duplicate detection of one session never run at
 * the same time; different sessions run in parallel. The implementation is
 * chosen with {@code gate-discovery.lock.strategy}:
 * - local: in-process locks, for a single instance (default)
 * - redis: SET NX with TTL and an owner-checked release, for several instances
 */
public interface SessionCycleLock {

    /**
     * Takes the lock without waiting. Returns false if another cycle holds it.
     */
    boolean tryAcquire(Long sessionId);

    /**
     * Waits up to {@code timeout} for the lock.
     */
    boolean tryAcquire(Long sessionId, Duration timeout);

    void release(Long sessionId);

    String getStrategyName();
}
