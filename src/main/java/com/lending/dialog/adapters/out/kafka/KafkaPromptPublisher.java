package com.lending.dialog.adapters.out.kafka;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lending.dialog.application.port.out.MessagingPort;
import com.lending.dialog.bootstrap.config.DialogProperties;
import com.lending.dialog.domain.entity.PromptOption;
import com.lending.dialog.domain.entity.PromptSpec;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Kafka implementation of the MessagingPort outbound port.
 * <p>
 * Each prompt is one JSON record on the outbound topic, keyed by identity so
 * a channel gateway receives one user's prompts in order. The send waits for
 * the broker acknowledgement up to {@code dialog.kafka.publish-ack-timeout}.
 * </p>
 */
@Component
public class KafkaPromptPublisher implements MessagingPort {

    private static final Logger log = LoggerFactory.getLogger(KafkaPromptPublisher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String outboundTopic;
    private final long publishAckTimeoutMs;

    private final Counter publishSuccess;
    private final Counter publishFailure;
    private final Timer publishLatency;

    public KafkaPromptPublisher(KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            DialogProperties properties,
            MeterRegistry meterRegistry) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.outboundTopic = properties.getKafka().getTopics().getOutbound();
        this.publishAckTimeoutMs = properties.getKafka().getPublishAckTimeout().toMillis();

        this.publishSuccess = meterRegistry.counter("dialog.prompt.publish.outcome", "status", "success");
        this.publishFailure = meterRegistry.counter("dialog.prompt.publish.outcome", "status", "failure");
        this.publishLatency = meterRegistry.timer("dialog.prompt.publish.latency");
    }

    @Override
    public void sendPrompt(String identity, PromptSpec prompt) {
        Timer.Sample sample = Timer.start();
        try {
            String json = serialize(identity, prompt);
            SendResult<String, String> result = kafkaTemplate.send(outboundTopic, identity, json)
                    .get(publishAckTimeoutMs, TimeUnit.MILLISECONDS);

            log.info("action=prompt_published identity={} kind={} options={} topic={} partition={} offset={}",
                    identity, prompt.getKind(), prompt.getOptions().size(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());
            publishSuccess.increment();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            publishFailure.increment();
            throw new IllegalStateException("Interrupted while publishing prompt for " + identity, e);
        } catch (Exception e) {
            publishFailure.increment();
            log.error("action=prompt_publish_failed identity={} kind={} error={}",
                    identity, prompt.getKind(), e.getMessage(), e);
            throw new IllegalStateException("Prompt publish failed for " + identity, e);
        } finally {
            sample.stop(publishLatency);
        }
    }

    String serialize(String identity, PromptSpec prompt) throws JsonProcessingException {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("identity", identity);
        message.put("kind", prompt.getKind().name());
        message.put("body", prompt.getBody());
        if (!prompt.getOptions().isEmpty()) {
            List<Map<String, String>> options = new ArrayList<>();
            for (PromptOption option : prompt.getOptions()) {
                options.add(Map.of("id", option.optionId(), "label", option.label()));
            }
            message.put("options", options);
        }
        prompt.getDocumentUrl().ifPresent(url -> message.put("document_url", url));
        prompt.getDocumentName().ifPresent(name -> message.put("document_name", name));
        message.put("sent_at", Instant.now().toString());
        return objectMapper.writeValueAsString(message);
    }
}
