package com.lending.dialog.application.exception;

/**
 * Stored session violates its invariant or cannot be read back, e.g. a step
 * that does not belong to the stored journey.
 */
public class StateCorruptionException extends RuntimeException {

    private final String identity;
    private final long storedVersion;

    public StateCorruptionException(String identity, long storedVersion, String message) {
        super(message);
        this.identity = identity;
        this.storedVersion = storedVersion;
    }

    public StateCorruptionException(String identity, long storedVersion, String message, Throwable cause) {
        super(message, cause);
        this.identity = identity;
        this.storedVersion = storedVersion;
    }

    public String getIdentity() {
        return identity;
    }

    /**
     * Version of the unreadable record, so a replacement can still win the
     * compare-and-set against it.
     */
    public long getStoredVersion() {
        return storedVersion;
    }
}
