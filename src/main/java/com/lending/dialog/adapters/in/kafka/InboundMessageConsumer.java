package com.lending.dialog.adapters.in.kafka;

import java.time.Clock;
import java.time.Instant;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lending.dialog.application.exception.SessionStoreException;
import com.lending.dialog.application.port.in.DialogOutcome;
import com.lending.dialog.application.port.in.HandleInboundEventUseCase;
import com.lending.dialog.bootstrap.config.DialogProperties;
import com.lending.dialog.domain.entity.InboundEvent;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Kafka inbound adapter: consumes user messages from the inbound topic.
 * <p>
 * Layered error handling:
 * <ol>
 * <li><b>Parse Error:</b> DLQ + skip</li>
 * <li><b>Invalid Event:</b> DLQ + skip</li>
 * <li><b>Session Store Error:</b> throw → Kafka redelivers</li>
 * <li><b>Unknown Error:</b> DLQ + skip</li>
 * </ol>
 * Timed-out events are acknowledged and only counted; the user's next
 * message retries naturally.
 * </p>
 */
@Component
public class InboundMessageConsumer {

    private static final Logger log = LoggerFactory.getLogger(InboundMessageConsumer.class);

    private final HandleInboundEventUseCase useCase;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final String dlqTopic;

    public InboundMessageConsumer(HandleInboundEventUseCase useCase,
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry,
            Clock clock,
            DialogProperties properties) {
        this.useCase = useCase;
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.dlqTopic = properties.getKafka().getTopics().getDlq();
    }

    /**
     * Main listener. Manual acknowledgment: an unacknowledged record is
     * redelivered after the container's error handling.
     */
    @KafkaListener(topics = "${dialog.kafka.topics.inbound:dialog-inbound}", groupId = "${dialog.kafka.group-id:loan-dialog}", containerFactory = "kafkaListenerContainerFactory")
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        String key = record.key();

        try {
            MDC.put("kafkaTopic", record.topic());
            MDC.put("kafkaPartition", String.valueOf(record.partition()));
            MDC.put("kafkaOffset", String.valueOf(record.offset()));

            log.info("action=message_received key={} partition={} offset={}",
                    key, record.partition(), record.offset());

            // Step 1: Parse
            InboundEvent event = parseEvent(record.value());
            MDC.put("identity", event.getIdentity());
            MDC.put("eventId", event.getEventId());

            // Step 2: Orchestrate
            DialogOutcome outcome = useCase.handle(event);
            meterRegistry.counter("dialog.inbound.outcome", "kind", outcome.kind().name()).increment();

            // Step 3: Acknowledge
            ack.acknowledge();
            log.info("action=message_acknowledged eventId={} identity={} outcome={} prompts={}",
                    event.getEventId(), event.getIdentity(), outcome.kind(), outcome.prompts().size());

        } catch (JsonProcessingException e) {
            log.error("action=parse_error key={} error={}", key, e.getMessage());
            sendToDlq(record, "PARSE_ERROR", e);
            ack.acknowledge();

        } catch (SessionStoreException e) {
            // Not acknowledged: the record is redelivered
            log.error("action=session_store_error key={} identity={} error={}", key, e.getIdentity(), e.getMessage());
            throw e;

        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("action=invalid_event key={} error={}", key, e.getMessage());
            sendToDlq(record, "INVALID_EVENT", e);
            ack.acknowledge();

        } catch (Exception e) {
            log.error("action=unknown_error key={} error={}", key, e.getMessage(), e);
            sendToDlq(record, "UNKNOWN_ERROR", e);
            ack.acknowledge();

        } finally {
            MDC.clear();
        }
    }

    // ─────────────────── Private Helpers ───────────────────

    InboundEvent parseEvent(String json) throws JsonProcessingException {
        if (json == null) {
            throw new IllegalArgumentException("record value is null");
        }
        return objectMapper.readValue(json, InboundDto.class).toDomain(clock);
    }

    private void sendToDlq(ConsumerRecord<String, String> record, String errorType, Exception error) {
        try {
            DlqMessage dlqMessage = new DlqMessage(
                    record.topic(),
                    record.partition(),
                    record.offset(),
                    record.key(),
                    record.value(),
                    errorType,
                    error.getMessage(),
                    clock.instant().toString());

            kafkaTemplate.send(dlqTopic, record.key(), objectMapper.writeValueAsString(dlqMessage));
            meterRegistry.counter("dialog.inbound.dlq", "type", errorType).increment();
            log.warn("action=sent_to_dlq errorType={} key={} originalTopic={}",
                    errorType, record.key(), record.topic());
        } catch (Exception dlqError) {
            log.error("action=dlq_send_failed key={} error={}", record.key(), dlqError.getMessage());
        }
    }

    // ─────────────────── Inner DTO Classes ───────────────────

    /**
     * Wire format of an inbound user message.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class InboundDto {

        @JsonProperty("event_id")
        private String eventId;

        @JsonProperty("identity")
        private String identity;

        @JsonProperty("text")
        private String text;

        @JsonProperty("option_id")
        private String optionId;

        @JsonProperty("media_id")
        private String mediaId;

        @JsonProperty("received_at")
        private Instant receivedAt;

        @JsonProperty("deadline")
        private Instant deadline;

        public InboundEvent toDomain(Clock clock) {
            return new InboundEvent(
                    eventId,
                    identity,
                    text,
                    optionId,
                    mediaId,
                    receivedAt != null ? receivedAt : clock.instant(),
                    deadline);
        }

        // Getters/Setters for Jackson
        public String getEventId() {
            return eventId;
        }

        public void setEventId(String eventId) {
            this.eventId = eventId;
        }

        public String getIdentity() {
            return identity;
        }

        public void setIdentity(String identity) {
            this.identity = identity;
        }

        public String getText() {
            return text;
        }

        public void setText(String text) {
            this.text = text;
        }

        public String getOptionId() {
            return optionId;
        }

        public void setOptionId(String optionId) {
            this.optionId = optionId;
        }

        public String getMediaId() {
            return mediaId;
        }

        public void setMediaId(String mediaId) {
            this.mediaId = mediaId;
        }

        public Instant getReceivedAt() {
            return receivedAt;
        }

        public void setReceivedAt(Instant receivedAt) {
            this.receivedAt = receivedAt;
        }

        public Instant getDeadline() {
            return deadline;
        }

        public void setDeadline(Instant deadline) {
            this.deadline = deadline;
        }
    }

    /**
     * DLQ message envelope with error context.
     */
    public record DlqMessage(
            String originalTopic,
            int originalPartition,
            long originalOffset,
            String originalKey,
            String originalValue,
            String errorType,
            String errorMessage,
            String timestamp) {
    }
}
