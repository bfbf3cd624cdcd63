package com.starscape.capture.common.concurrency;

import com.starscape.capture.common.config.CaptureProperties;
import com.starscape.capture.common.exception.InvalidStateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AggregateLocksTest {

    private AggregateLocks locks;

    @BeforeEach
    void setUp() {
        CaptureProperties properties = new CaptureProperties();
        properties.setLockTimeout(Duration.ofMillis(200));
        locks = new AggregateLocks(properties);
    }

    @Test
    void releasedIdsAreNotRetained() {
        for (int i = 0; i < 10_000; i++) {
            String id = "post-" + i;
            assertEquals(id, locks.withLock("instagram.post", id, () -> id));
        }

        assertEquals(0, locks.trackedKeys());
    }

    @Test
    void failedCommandStillReleasesItsId() {
        assertThrows(IllegalArgumentException.class, () -> locks.withLock("instagram.post", "p-1", () -> {
            throw new IllegalArgumentException("rejected");
        }));

        assertEquals(0, locks.trackedKeys());
    }

    @Test
    void sameIdRunsOneAtATime() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return locks.withLock("instagram.post", "p-1", () -> {
                        maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                        inFlight.decrementAndGet();
                        return null;
                    });
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, maxInFlight.get());
        assertEquals(0, locks.trackedKeys());
    }

    @Test
    void waiterTimesOutWhileIdIsHeld() throws Exception {
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> locks.withLock("pinterest.board", "b-1", () -> {
            held.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }));
        holder.start();
        assertTrue(held.await(5, TimeUnit.SECONDS));

        InvalidStateException ex = assertThrows(InvalidStateException.class,
                () -> locks.withLock("pinterest.board", "b-1", () -> null));
        assertEquals("AGGREGATE_BUSY", ex.getCode());

        release.countDown();
        holder.join(5000);
        assertEquals(0, locks.trackedKeys());
    }
}
