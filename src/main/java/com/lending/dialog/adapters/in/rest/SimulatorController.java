package com.lending.dialog.adapters.in.rest;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lending.dialog.adapters.out.postgres.PostgresAuditSink;
import com.lending.dialog.application.port.out.SessionStore;
import com.lending.dialog.bootstrap.config.DialogProperties;
import com.lending.dialog.domain.entity.Offer;
import com.lending.dialog.domain.entity.Session;

/**
 * REST controller for simulating a messaging channel.
 * <p>
 * Pushes user messages onto the inbound topic exactly as a channel gateway
 * would, and exposes the stored session and interaction history for
 * inspection.
 * </p>
 */
@RestController
@RequestMapping("/api/simulator")
public class SimulatorController {

    private static final Logger log = LoggerFactory.getLogger(SimulatorController.class);
    private static final int MAX_HISTORY = 200;

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final SessionStore sessionStore;
    private final PostgresAuditSink auditSink;
    private final ObjectMapper objectMapper;
    private final String inboundTopic;

    public SimulatorController(KafkaTemplate<String, String> kafkaTemplate,
            SessionStore sessionStore,
            PostgresAuditSink auditSink,
            ObjectMapper objectMapper,
            DialogProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.sessionStore = sessionStore;
        this.auditSink = auditSink;
        this.objectMapper = objectMapper;
        this.inboundTopic = properties.getKafka().getTopics().getInbound();
    }

    /**
     * Publishes a user message.
     * <p>
     * Usage: POST /api/simulator/messages/{identity} with
     * {@code {"text": "loan"}}, {@code {"option_id": "lang_en"}} or
     * {@code {"media_id": "selfie-1"}}
     * </p>
     */
    @PostMapping("/messages/{identity}")
    public ResponseEntity<Map<String, Object>> publishMessage(
            @PathVariable String identity,
            @RequestBody Map<String, String> body) {

        String eventId = UUID.randomUUID().toString();
        String receivedAt = Instant.now().toString();

        try {
            Map<String, Object> event = new LinkedHashMap<>();
            event.put("event_id", eventId);
            event.put("identity", identity);
            event.put("text", body.get("text"));
            event.put("option_id", body.get("option_id"));
            event.put("media_id", body.get("media_id"));
            event.put("received_at", receivedAt);

            // Identity as partition key keeps one user's messages ordered
            kafkaTemplate.send(inboundTopic, identity, objectMapper.writeValueAsString(event));

            log.info("action=simulated_message_published eventId={} identity={}", eventId, identity);

            return ResponseEntity.ok(Map.of(
                    "status", "published",
                    "eventId", eventId,
                    "identity", identity,
                    "receivedAt", receivedAt,
                    "topic", inboundTopic));

        } catch (Exception e) {
            log.error("action=simulated_message_error identity={} error={}", identity, e.getMessage());
            return ResponseEntity.internalServerError().body(
                    Map.of("status", "error", "message", String.valueOf(e.getMessage())));
        }
    }

    /**
     * Current session of an identity.
     * <p>
     * Usage: GET /api/simulator/sessions/{identity}
     * </p>
     */
    @GetMapping("/sessions/{identity}")
    public ResponseEntity<Map<String, Object>> getSession(@PathVariable String identity) {
        Optional<Session> loaded = sessionStore.load(identity);
        if (loaded.isEmpty()) {
            return ResponseEntity.ok(Map.of(
                    "identity", identity,
                    "status", "no_session"));
        }

        Session session = loaded.get();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("identity", session.getIdentity());
        response.put("journey", session.getJourney().name());
        response.put("currentStep", session.getCurrentStep() != null ? session.getCurrentStep().name() : null);
        response.put("language", session.getLanguage() != null ? session.getLanguage().name() : null);
        response.put("answers", stringify(session.getAnswers()));
        response.put("flags", session.getFlags());
        response.put("offers", session.getOffers().stream().map(Offer::toString).toList());
        response.put("lastActivityAt", session.getLastActivityAt().toString());
        response.put("version", session.getVersion());
        return ResponseEntity.ok(response);
    }

    /**
     * Recent interaction events, newest first.
     * <p>
     * Usage: GET /api/simulator/history/{identity}?limit=50
     * </p>
     */
    @GetMapping("/history/{identity}")
    public ResponseEntity<List<Map<String, Object>>> getHistory(
            @PathVariable String identity,
            @RequestParam(name = "limit", required = false, defaultValue = "50") int limit) {
        int effectiveLimit = Math.max(1, Math.min(limit, MAX_HISTORY));
        return ResponseEntity.ok(auditSink.recent(identity, effectiveLimit));
    }

    private static Map<String, String> stringify(Map<String, Object> answers) {
        Map<String, String> out = new LinkedHashMap<>();
        answers.forEach((key, value) -> out.put(key, String.valueOf(value)));
        return out;
    }
}
