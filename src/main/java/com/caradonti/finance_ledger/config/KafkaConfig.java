package com.caradonti.finance_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics owned by this service.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.notifications:notifications}")
    private String notificationsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    /**
     * Messages are keyed by aggregate id, so one aggregate's notifications
     * stay ordered within a partition.
     */
    @Bean
    public NewTopic notificationsTopic() {
        return TopicBuilder.name(notificationsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
