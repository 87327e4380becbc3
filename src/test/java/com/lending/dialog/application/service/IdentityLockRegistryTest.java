package com.lending.dialog.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.lending.dialog.application.exception.SessionStoreException;

class IdentityLockRegistryTest {

    @Test
    void testSameIdentity_NeverOverlaps() throws Exception {
        // Given
        IdentityLockRegistry locks = new IdentityLockRegistry(Duration.ofSeconds(5));
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(6);
        List<Future<?>> futures = new ArrayList<>();

        // When
        try {
            for (int i = 0; i < 30; i++) {
                futures.add(pool.submit(() -> locks.withLock("u1", () -> {
                    maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                    sleep(2);
                    return inside.decrementAndGet();
                })));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        // Then
        assertEquals(1, maxInside.get());
        assertEquals(0, locks.activeCount());
    }

    @Test
    void testDifferentIdentities_RunInParallel() throws Exception {
        // Given
        IdentityLockRegistry locks = new IdentityLockRegistry(Duration.ofSeconds(5));
        CountDownLatch bothInside = new CountDownLatch(2);
        ExecutorService pool = Executors.newFixedThreadPool(2);

        // When
        try {
            Future<Boolean> a = pool.submit(() -> locks.withLock("a", () -> awaitBoth(bothInside)));
            Future<Boolean> b = pool.submit(() -> locks.withLock("b", () -> awaitBoth(bothInside)));

            // Then
            assertTrue(a.get(5, TimeUnit.SECONDS));
            assertTrue(b.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testLockTimeout_ThrowsSessionStoreException() throws Exception {
        // Given
        IdentityLockRegistry locks = new IdentityLockRegistry(Duration.ofMillis(50));
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();

        try {
            pool.submit(() -> locks.withLock("u1", () -> {
                held.countDown();
                return awaitQuietly(release);
            }));
            assertTrue(held.await(5, TimeUnit.SECONDS));

            // When / Then
            assertThrows(SessionStoreException.class, () -> locks.withLock("u1", () -> "never"));
        } finally {
            release.countDown();
            pool.shutdown();
            pool.awaitTermination(5, TimeUnit.SECONDS);
        }
        assertEquals(0, locks.activeCount());
    }

    private static boolean awaitBoth(CountDownLatch latch) {
        latch.countDown();
        return awaitQuietly(latch);
    }

    private static boolean awaitQuietly(CountDownLatch latch) {
        try {
            return latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
