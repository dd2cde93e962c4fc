package com.flagship.reconciliation_engine.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics for published workflow events, one per document type.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.reconciliations:reconciliation-events}")
    private String reconciliationsTopic;

    @Value("${kafka.topic.filings:filing-events}")
    private String filingsTopic;

    @Bean
    public NewTopic reconciliationsTopic() {
        return TopicBuilder.name(reconciliationsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic filingsTopic() {
        return TopicBuilder.name(filingsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
