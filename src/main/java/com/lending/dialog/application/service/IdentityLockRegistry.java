package com.lending.dialog.application.service;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.logging.Logger;

import com.lending.dialog.application.exception.SessionStoreException;

/**
 * One lock per user identity, created on demand and dropped when the last
 * holder or waiter leaves.
 * <p>
 * Events for different identities never contend; events for the same
 * identity are serialized in this JVM. The holder count is only touched
 * inside {@link ConcurrentHashMap#compute}, which is atomic per key.
 * </p>
 */
public class IdentityLockRegistry {

    private static final Logger log = Logger.getLogger(IdentityLockRegistry.class.getName());

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Duration timeout;

    public IdentityLockRegistry(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0, got: " + timeout);
        }
        this.timeout = timeout;
    }

    /**
     * Runs an action while holding the identity's lock.
     *
     * @throws SessionStoreException if the lock is not acquired within the timeout
     *                               or the wait is interrupted
     */
    public <T> T withLock(String identity, Supplier<T> action) {
        Entry entry = entries.compute(identity, (key, existing) -> {
            Entry e = existing != null ? existing : new Entry();
            e.holders++;
            return e;
        });

        boolean acquired = false;
        try {
            acquired = entry.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!acquired) {
                log.warning(String.format("action=lock_timeout identity=%s waited=%dms", identity, timeout.toMillis()));
                throw new SessionStoreException(identity,
                        "Could not lock session for " + identity + " within " + timeout.toMillis() + "ms");
            }
            return action.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionStoreException(identity, "Interrupted while waiting for session lock of " + identity, e);
        } finally {
            if (acquired) {
                entry.lock.unlock();
            }
            entries.computeIfPresent(identity, (key, e) -> --e.holders == 0 ? null : e);
        }
    }

    /**
     * @return number of identities currently locked or waited on
     */
    public int activeCount() {
        return entries.size();
    }
}
