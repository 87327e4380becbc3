package com.lending.dialog.application.exception;

/**
 * Session could not be loaded or saved. Propagates to the transport so the
 * event is redelivered.
 */
public class SessionStoreException extends RuntimeException {

    private final String identity;

    public SessionStoreException(String identity, String message) {
        super(message);
        this.identity = identity;
    }

    public SessionStoreException(String identity, String message, Throwable cause) {
        super(message, cause);
        this.identity = identity;
    }

    public String getIdentity() {
        return identity;
    }
}
