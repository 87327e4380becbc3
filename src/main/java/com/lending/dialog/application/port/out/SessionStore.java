package com.lending.dialog.application.port.out;

import java.util.Optional;

import com.lending.dialog.application.exception.SessionStoreException;
import com.lending.dialog.domain.entity.Session;

/**
 * Secondary (outbound) port: session persistence abstraction.
 * <p>
 * Keyed by user identity. Implementations must apply {@link #save(Session)}
 * atomically and reject a save whose version no longer matches the stored
 * one, so two writers can never silently overwrite each other.
 * </p>
 */
public interface SessionStore {

    /**
     * Loads the session for an identity.
     *
     * @param identity user identity
     * @return stored session, or empty if the identity has never been seen
     * @throws SessionStoreException if the store is unreachable or the payload unreadable
     */
    Optional<Session> load(String identity);

    /**
     * Saves the session. The stored version must equal {@code session.getVersion()};
     * on success the stored version is incremented.
     *
     * @param session session to save
     * @throws SessionStoreException on I/O failure or version conflict
     */
    void save(Session session);
}
