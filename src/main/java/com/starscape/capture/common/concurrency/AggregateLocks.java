package com.starscape.capture.common.concurrency;

import com.starscape.capture.common.config.CaptureProperties;
import com.starscape.capture.common.exception.InvalidStateException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-aggregate mutual exclusion: at most one command in flight per aggregate id.
 * An id's lock lives in the map only while some thread holds or waits for it.
 */
@Component
public class AggregateLocks {

    private final ConcurrentMap<String, CountedLock> locks = new ConcurrentHashMap<>();
    private final Duration timeout;

    public AggregateLocks(CaptureProperties properties) {
        this.timeout = properties.getLockTimeout();
    }

    public <T> T withLock(String aggregateType, String aggregateId, Supplier<T> action) {
        String key = aggregateType + ":" + aggregateId;
        CountedLock entry = locks.compute(key, (k, existing) -> {
            CountedLock counted = existing != null ? existing : new CountedLock();
            counted.users++;
            return counted;
        });
        try {
            boolean acquired;
            try {
                acquired = entry.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for " + key, e);
            }
            if (!acquired) {
                throw new InvalidStateException("AGGREGATE_BUSY",
                        "Timed out after " + timeout.toMillis() + "ms waiting for " + key);
            }
            try {
                return action.get();
            } finally {
                entry.lock.unlock();
            }
        } finally {
            release(key);
        }
    }

    /**
     * Number of ids that currently have a holder or a waiter.
     */
    int trackedKeys() {
        return locks.size();
    }

    private void release(String key) {
        locks.computeIfPresent(key, (k, counted) -> --counted.users == 0 ? null : counted);
    }

    // users is only read and written inside compute/computeIfPresent for its key
    private static final class CountedLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
