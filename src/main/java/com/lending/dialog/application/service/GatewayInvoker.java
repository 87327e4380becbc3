package com.lending.dialog.application.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.lending.dialog.application.exception.GatewayFailureException;
import com.lending.dialog.application.exception.GatewayTimeoutException;

/**
 * Runs decision and support calls on a bounded executor and waits until the
 * event's deadline, or the default timeout when the event has none.
 * <p>
 * No retries: a failed or late call surfaces to the orchestrator, which
 * leaves the session unsaved so the user (or the transport) can try again.
 * </p>
 */
public class GatewayInvoker {

    private static final Logger log = Logger.getLogger(GatewayInvoker.class.getName());

    private final ExecutorService executor;
    private final Duration defaultTimeout;
    private final Clock clock;

    public GatewayInvoker(ExecutorService executor, Duration defaultTimeout, Clock clock) {
        if (executor == null)
            throw new IllegalArgumentException("executor cannot be null");
        if (defaultTimeout == null || defaultTimeout.isNegative() || defaultTimeout.isZero())
            throw new IllegalArgumentException("defaultTimeout must be positive, got: " + defaultTimeout);
        if (clock == null)
            throw new IllegalArgumentException("clock cannot be null");

        this.executor = executor;
        this.defaultTimeout = defaultTimeout;
        this.clock = clock;
    }

    /**
     * Invokes a gateway call with a deadline.
     *
     * @param gateway  name used in logs and errors
     * @param call     the remote call
     * @param deadline absolute deadline, or null for the default timeout
     * @return the call's result
     * @throws GatewayTimeoutException if the deadline passes first
     * @throws GatewayFailureException if the call throws or is rejected by the executor
     */
    public <T> T invoke(String gateway, Supplier<T> call, Instant deadline) {
        Duration wait = deadline != null ? Duration.between(clock.instant(), deadline) : defaultTimeout;
        if (wait.isNegative() || wait.isZero()) {
            throw new GatewayTimeoutException(gateway, Duration.ZERO);
        }

        Future<T> future;
        try {
            future = executor.submit(call::get);
        } catch (RejectedExecutionException e) {
            throw new GatewayFailureException(gateway, gateway + " executor saturated", e);
        }

        long start = System.nanoTime();
        try {
            T result = future.get(wait.toMillis(), TimeUnit.MILLISECONDS);
            log.fine(String.format("action=gateway_call gateway=%s latency=%dms",
                    gateway, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)));
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warning(String.format("action=gateway_timeout gateway=%s waited=%dms", gateway, wait.toMillis()));
            throw new GatewayTimeoutException(gateway, wait);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.log(Level.WARNING, String.format("action=gateway_error gateway=%s error=%s",
                    gateway, cause != null ? cause.getMessage() : e.getMessage()), cause);
            if (cause instanceof GatewayFailureException) {
                throw (GatewayFailureException) cause;
            }
            throw new GatewayFailureException(gateway, gateway + " call failed", cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new GatewayFailureException(gateway, "Interrupted while waiting for " + gateway, e);
        }
    }
}
