package com.lending.dialog.adapters.in.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lending.dialog.application.exception.SessionStoreException;
import com.lending.dialog.application.port.in.DialogOutcome;
import com.lending.dialog.application.port.in.HandleInboundEventUseCase;
import com.lending.dialog.bootstrap.config.DialogProperties;
import com.lending.dialog.domain.entity.InboundEvent;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

@ExtendWith(MockitoExtension.class)
class InboundMessageConsumerTest {

    private static final String TOPIC = "dialog-inbound";
    private static final String DLQ = "dialog-inbound-dlq";
    private static final Instant NOW = Instant.parse("2026-01-15T10:05:00Z");

    @Mock
    private HandleInboundEventUseCase useCase;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private Acknowledgment ack;

    private SimpleMeterRegistry meterRegistry;
    private InboundMessageConsumer consumer;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        consumer = new InboundMessageConsumer(useCase, kafkaTemplate, objectMapper, meterRegistry,
                Clock.fixed(NOW, ZoneOffset.UTC), new DialogProperties());
    }

    @Test
    void testValidMessage_HandledAndAcknowledged() {
        // Given
        String json = "{\"event_id\":\"wamid.1\",\"identity\":\"u1\",\"text\":\"hi\","
                + "\"received_at\":\"2026-01-15T10:00:00Z\"}";
        when(useCase.handle(any())).thenReturn(new DialogOutcome(DialogOutcome.Kind.ADVANCED, List.of(), null));

        // When
        consumer.consume(record(json), ack);

        // Then
        verify(useCase).handle(argThat(event -> "wamid.1".equals(event.getEventId())
                && "hi".equals(event.getText())
                && Instant.parse("2026-01-15T10:00:00Z").equals(event.getReceivedAt())));
        verify(ack).acknowledge();
        assertEquals(1.0, meterRegistry.counter("dialog.inbound.outcome", "kind", "ADVANCED").count());
    }

    @Test
    void testMalformedJson_SentToDlqAndAcknowledged() {
        // When
        consumer.consume(record("{not json"), ack);

        // Then
        verifyNoInteractions(useCase);
        verify(kafkaTemplate).send(eq(DLQ), eq("u1"), argThat(body -> body.contains("PARSE_ERROR")));
        verify(ack).acknowledge();
        assertEquals(1.0, meterRegistry.counter("dialog.inbound.dlq", "type", "PARSE_ERROR").count());
    }

    @Test
    void testEventWithoutInput_InvalidEvent() {
        // When
        consumer.consume(record("{\"event_id\":\"wamid.2\",\"identity\":\"u1\"}"), ack);

        // Then
        verifyNoInteractions(useCase);
        verify(kafkaTemplate).send(eq(DLQ), eq("u1"), argThat(body -> body.contains("INVALID_EVENT")));
        verify(ack).acknowledge();
    }

    @Test
    void testSessionStoreFailure_RethrownWithoutAck() {
        // Given
        when(useCase.handle(any())).thenThrow(new SessionStoreException("u1", "redis down"));
        ConsumerRecord<String, String> message = record("{\"event_id\":\"wamid.3\",\"identity\":\"u1\",\"text\":\"hi\"}");

        // When / Then
        assertThrows(SessionStoreException.class, () -> consumer.consume(message, ack));
        verify(ack, never()).acknowledge();
        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
    }

    @Test
    void testUnexpectedFailure_SentToDlq() {
        // Given
        when(useCase.handle(any())).thenThrow(new UnsupportedOperationException("boom"));

        // When
        consumer.consume(record("{\"event_id\":\"wamid.4\",\"identity\":\"u1\",\"option_id\":\"consent_yes\"}"), ack);

        // Then
        verify(kafkaTemplate).send(eq(DLQ), eq("u1"), argThat(body -> body.contains("UNKNOWN_ERROR")));
        verify(ack).acknowledge();
    }

    @Test
    void testParseEvent_MissingReceivedAtUsesClock() throws Exception {
        // When
        InboundEvent event = consumer.parseEvent(
                "{\"event_id\":\"wamid.5\",\"identity\":\"u1\",\"media_id\":\"media-9\",\"ignored\":1}");

        // Then
        assertEquals("media-9", event.getMediaId());
        assertEquals("u1", event.getIdentity());
        assertEquals(NOW, event.getReceivedAt());
        assertNull(event.getDeadline());
    }

    private static ConsumerRecord<String, String> record(String value) {
        return new ConsumerRecord<>(TOPIC, 0, 42L, "u1", value);
    }
}
