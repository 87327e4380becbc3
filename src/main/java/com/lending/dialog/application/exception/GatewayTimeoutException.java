package com.lending.dialog.application.exception;

import java.time.Duration;

/**
 * A gateway call did not finish before the event's deadline.
 */
public class GatewayTimeoutException extends RuntimeException {

    private final Duration waited;

    public GatewayTimeoutException(String gateway, Duration waited) {
        super(gateway + " did not respond within " + waited.toMillis() + "ms");
        this.waited = waited;
    }

    public Duration getWaited() {
        return waited;
    }
}
