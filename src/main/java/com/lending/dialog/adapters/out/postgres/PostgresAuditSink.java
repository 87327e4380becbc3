package com.lending.dialog.adapters.out.postgres;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lending.dialog.application.port.out.AuditSink;

/**
 * PostgreSQL implementation of the AuditSink outbound port.
 * <p>
 * Append-only {@code interaction_events} table; the payload is stored in a
 * JSONB column.
 * </p>
 */
@Component
public class PostgresAuditSink implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger(PostgresAuditSink.class);

    private static final String INSERT_EVENT_SQL = "INSERT INTO interaction_events (identity, event_kind, payload, created_at) "
            + "VALUES (?, ?, ?::jsonb, ?)";

    private static final String SELECT_BY_IDENTITY_SQL = "SELECT event_kind, payload, created_at "
            + "FROM interaction_events WHERE identity = ? "
            + "ORDER BY created_at DESC LIMIT ?";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public PostgresAuditSink(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void record(String identity, String eventKind, Map<String, Object> payload, Instant timestamp) {
        try {
            String payloadJson = objectMapper.writeValueAsString(payload != null ? payload : Map.of());
            jdbcTemplate.update(INSERT_EVENT_SQL, identity, eventKind, payloadJson, Timestamp.from(timestamp));
            log.debug("action=audit_recorded identity={} kind={}", identity, eventKind);
        } catch (JsonProcessingException e) {
            log.error("action=audit_serialize_error identity={} kind={} error={}",
                    identity, eventKind, e.getMessage());
            throw new IllegalArgumentException("Failed to serialize audit payload for " + eventKind, e);
        }
    }

    /**
     * Most recent interaction events of one identity, newest first. Used by the
     * simulator endpoints.
     */
    public List<Map<String, Object>> recent(String identity, int limit) {
        return jdbcTemplate.query(SELECT_BY_IDENTITY_SQL,
                (rs, rowNum) -> Map.<String, Object>of(
                        "event_kind", rs.getString("event_kind"),
                        "payload", rs.getString("payload"),
                        "created_at", rs.getTimestamp("created_at").toInstant().toString()),
                identity, limit);
    }
}
