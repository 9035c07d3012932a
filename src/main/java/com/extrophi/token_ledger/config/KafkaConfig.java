package com.extrophi.token_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

/**
 * Kafka setup for the content-event consumer. Only active with the consumer,
 * so the admin client never looks for a broker when consumption is off.
 */
@Configuration
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.content-events:content-events}")
    private String contentEventsTopic;

    @Value("${kafka.topic.content-events-partitions:3}")
    private int partitions;

    @Value("${consumer.retry-interval-ms:1000}")
    private long retryIntervalMs;

    @Bean
    public NewTopic contentEventsTopic() {
        return TopicBuilder.name(contentEventsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }

    /**
     * The listener only throws for storage faults. Those records are retried
     * in place until the database is back; giving up would lose a reward.
     */
    @Bean
    public DefaultErrorHandler contentEventErrorHandler() {
        return new DefaultErrorHandler(new FixedBackOff(retryIntervalMs, FixedBackOff.UNLIMITED_ATTEMPTS));
    }
}
