package com.lending.dialog.application.exception;

/**
 * A decision or support gateway call failed or returned unusable data.
 */
public class GatewayFailureException extends RuntimeException {

    private final String gateway;

    public GatewayFailureException(String gateway, String message) {
        super(message);
        this.gateway = gateway;
    }

    public GatewayFailureException(String gateway, String message, Throwable cause) {
        super(message, cause);
        this.gateway = gateway;
    }

    public String getGateway() {
        return gateway;
    }
}
