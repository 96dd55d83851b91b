package com.gocomet.tripsafety.common.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic definitions.
 *
 * Topics:
 * trip-lifecycle: STARTED / COMPLETED signals from the trip service; keyed by tripId
 * sos-events: append-only audit log of every SOS alert transition; keyed by alertId
 *
 * Partition count is 2 for local dev. Increase for production.
 */
@Configuration
public class KafkaConfig {

    @Value("${app.kafka.topics.trip-lifecycle}")
    private String tripLifecycleTopic;

    @Value("${app.kafka.topics.sos-events}")
    private String sosEventsTopic;

    @Bean
    public NewTopic tripLifecycleTopic() {
        return TopicBuilder.name(tripLifecycleTopic)
                .partitions(2)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic sosEventsTopic() {
        return TopicBuilder.name(sosEventsTopic)
                .partitions(2)
                .replicas(1)
                .build();
    }
}
