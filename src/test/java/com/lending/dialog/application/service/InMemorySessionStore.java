package com.lending.dialog.application.service;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import com.lending.dialog.application.exception.SessionStoreException;
import com.lending.dialog.application.exception.StateCorruptionException;
import com.lending.dialog.application.port.out.SessionStore;
import com.lending.dialog.domain.entity.Session;

/**
 * SessionStore test double with the same version compare-and-set as the
 * Redis adapter.
 */
class InMemorySessionStore implements SessionStore {

    private final ConcurrentHashMap<String, Session> sessions = new ConcurrentHashMap<>();
    private final AtomicInteger saves = new AtomicInteger();
    private volatile boolean failSaves;
    private volatile Long unreadableVersion;

    @Override
    public Optional<Session> load(String identity) {
        if (unreadableVersion != null) {
            throw new StateCorruptionException(identity, unreadableVersion, "payload unreadable");
        }
        return Optional.ofNullable(sessions.get(identity));
    }

    @Override
    public void save(Session session) {
        if (failSaves) {
            throw new SessionStoreException(session.getIdentity(), "store unavailable");
        }
        Long unreadable = unreadableVersion;
        sessions.compute(session.getIdentity(), (identity, current) -> {
            long stored = unreadable != null ? unreadable : current != null ? current.getVersion() : 0L;
            if (stored != session.getVersion()) {
                throw new SessionStoreException(identity, "version conflict: stored " + stored
                        + " expected " + session.getVersion());
            }
            return session.withVersion(stored + 1);
        });
        unreadableVersion = null;
        saves.incrementAndGet();
    }

    void put(Session session) {
        sessions.put(session.getIdentity(), session);
    }

    Session get(String identity) {
        return sessions.get(identity);
    }

    int saveCount() {
        return saves.get();
    }

    void failSaves() {
        this.failSaves = true;
    }

    void makeUnreadable(long storedVersion) {
        this.unreadableVersion = storedVersion;
    }
}
