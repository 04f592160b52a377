package com.gatediscovery.engine.lock;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process session lock for single-instance deployments.
 *
 * Reentrant for the owning thread, so an operator merge that runs under the
 * lock can call into code that takes it again.
 *
 * A session's entry counts the threads holding or waiting for its lock and is
 * dropped when that count returns to zero, so the map only holds sessions with
 * a cycle in flight.
 */
@Slf4j
public class LocalSessionCycleLock implements SessionCycleLock {

    private final Map<Long, Entry> locks = new ConcurrentHashMap<>();

    @Override
    public boolean tryAcquire(Long sessionId) {
        Entry entry = retain(sessionId);
        boolean acquired = entry.lock.tryLock();
        if (!acquired) {
            unretain(sessionId);
            log.debug("[LocalLock] Session {} is busy", sessionId);
        }
        return acquired;
    }

    @Override
    public boolean tryAcquire(Long sessionId, Duration timeout) {
        Entry entry = retain(sessionId);
        boolean acquired = false;
        try {
            acquired = entry.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return acquired;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[LocalLock] Interrupted while waiting for session {}", sessionId);
            return false;
        } finally {
            if (!acquired) {
                unretain(sessionId);
            }
        }
    }

    @Override
    public void release(Long sessionId) {
        Entry entry = locks.get(sessionId);
        if (entry != null && entry.lock.isHeldByCurrentThread()) {
            entry.lock.unlock();
            unretain(sessionId);
        }
    }

    @Override
    public String getStrategyName() {
        return "local";
    }

    int trackedSessions() {
        return locks.size();
    }

    private Entry retain(Long sessionId) {
        return locks.compute(sessionId, (id, entry) -> {
            Entry current = entry != null ? entry : new Entry();
            current.users++;
            return current;
        });
    }

    private void unretain(Long sessionId) {
        locks.computeIfPresent(sessionId, (id, entry) -> --entry.users == 0 ? null : entry);
    }

    /**
     * Users are only read and written inside the map's per-key compute.
     */
    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
