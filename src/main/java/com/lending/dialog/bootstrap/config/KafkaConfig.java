package com.lending.dialog.bootstrap.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

/**
 * Kafka topics and listener container.
 * <p>
 * Inbound records are keyed by identity, so each partition carries a given
 * user's messages in order. The listener acknowledges manually; a thrown
 * exception (session store failure) is retried with a fixed back-off, up
 * to ten times.
 * </p>
 */
@Configuration
public class KafkaConfig {

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, String> kafkaListenerContainerFactory(
            ConsumerFactory<String, String> consumerFactory) {
        ConcurrentKafkaListenerContainerFactory<String, String> factory = new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(consumerFactory);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);
        factory.setCommonErrorHandler(new DefaultErrorHandler(new FixedBackOff(1000L, 10L)));
        return factory;
    }

    @Bean
    public NewTopic inboundTopic(DialogProperties properties) {
        return topic(properties.getKafka().getTopics().getInbound(), properties);
    }

    @Bean
    public NewTopic outboundTopic(DialogProperties properties) {
        return topic(properties.getKafka().getTopics().getOutbound(), properties);
    }

    @Bean
    public NewTopic dlqTopic(DialogProperties properties) {
        return topic(properties.getKafka().getTopics().getDlq(), properties);
    }

    private static NewTopic topic(String name, DialogProperties properties) {
        return TopicBuilder.name(name)
                .partitions(properties.getKafka().getPartitions())
                .replicas(properties.getKafka().getReplicationFactor())
                .build();
    }
}
