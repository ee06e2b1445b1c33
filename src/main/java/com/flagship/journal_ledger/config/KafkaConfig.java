package com.flagship.journal_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topic for ledger events. Keyed by entry id, so all events of one entry
 * land on the same partition in order.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.journal-entries:journal-entries}")
    private String journalEntriesTopic;

    @Bean
    public NewTopic journalEntriesTopic() {
        return TopicBuilder.name(journalEntriesTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
