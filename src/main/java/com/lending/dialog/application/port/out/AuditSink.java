package com.lending.dialog.application.port.out;

import java.time.Instant;
import java.util.Map;

/**
 * Secondary (outbound) port: append-only interaction audit trail.
 * <p>
 * Fire-and-forget from the orchestrator's point of view: failures are
 * logged by the caller and never abort a transition.
 * </p>
 */
public interface AuditSink {

    /**
     * @param identity  user identity
     * @param eventKind e.g. {@code inbound}, {@code session_reset}, {@code offers_truncated}
     * @param payload   event details, serialized by the implementation
     * @param timestamp when it happened
     */
    void record(String identity, String eventKind, Map<String, Object> payload, Instant timestamp);
}
