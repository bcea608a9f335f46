package com.flagship.escrow_engine.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topics for outbox events and notifications.
 *
 * Events are keyed by aggregate ID, so 3 partitions keep per-aggregate ordering
 * while allowing parallel consumers.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.contracts:contracts}")
    private String contractsTopic;

    @Value("${kafka.topic.payments:payments}")
    private String paymentsTopic;

    @Value("${kafka.topic.referrals:referrals}")
    private String referralsTopic;

    @Value("${kafka.topic.notifications:notifications}")
    private String notificationsTopic;

    @Bean
    public NewTopic contractsTopic() {
        return TopicBuilder.name(contractsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic paymentsTopic() {
        return TopicBuilder.name(paymentsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic referralsTopic() {
        return TopicBuilder.name(referralsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic notificationsTopic() {
        return TopicBuilder.name(notificationsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
