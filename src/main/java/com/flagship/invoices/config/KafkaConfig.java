package com.flagship.invoices.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.config.TopicConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic provisioning.
 *
 * Every topic is keyed so that one invoice always lands on one partition:
 * - events: keyed by origin id, kept forever (the event log downstream)
 * - commands: keyed by origin id, short-lived
 * - command-results: keyed by command id, short-lived
 * - snapshots: keyed by origin id, compacted to the latest snapshot per invoice
 */
@Configuration
public class KafkaConfig {

    private static final String RETAIN_FOREVER = "-1";

    @Value("${kafka.topic.partitions:4}")
    private int partitions;

    @Value("${kafka.topic.replicas:1}")
    private int replicas;

    @Value("${kafka.topic.transient-retention-ms:300000}")
    private long transientRetentionMs;

    @Bean
    public NewTopic eventsTopic(TopicNames topics) {
        return TopicBuilder.name(topics.getEvents())
                .partitions(partitions)
                .replicas(replicas)
                .config(TopicConfig.RETENTION_MS_CONFIG, RETAIN_FOREVER)
                .build();
    }

    @Bean
    public NewTopic commandsTopic(TopicNames topics) {
        return TopicBuilder.name(topics.getCommands())
                .partitions(partitions)
                .replicas(replicas)
                .config(TopicConfig.RETENTION_MS_CONFIG, String.valueOf(transientRetentionMs))
                .build();
    }

    @Bean
    public NewTopic commandResultsTopic(TopicNames topics) {
        return TopicBuilder.name(topics.getCommandResults())
                .partitions(partitions)
                .replicas(replicas)
                .config(TopicConfig.RETENTION_MS_CONFIG, String.valueOf(transientRetentionMs))
                .build();
    }

    @Bean
    public NewTopic snapshotsTopic(TopicNames topics) {
        return TopicBuilder.name(topics.getSnapshots())
                .partitions(partitions)
                .replicas(replicas)
                .compact()
                .build();
    }
}
