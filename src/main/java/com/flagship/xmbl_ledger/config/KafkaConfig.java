package com.flagship.xmbl_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.ledger-events:xmbl-ledger-events}")
    private String ledgerEventsTopic;

    /**
     * Creates the ledger events topic if it doesn't exist.
     * Events are keyed by aggregate id, so ordering holds per share.
     */
    @Bean
    public NewTopic ledgerEventsTopic() {
        return TopicBuilder.name(ledgerEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
