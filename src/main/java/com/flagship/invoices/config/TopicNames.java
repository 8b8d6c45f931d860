package com.flagship.invoices.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Kafka topic names, resolved once from configuration.
 */
@Component
@Getter
public class TopicNames {

    @Value("${kafka.topic.events:invoices.topic.events}")
    private String events;

    @Value("${kafka.topic.commands:invoices.topic.commands}")
    private String commands;

    @Value("${kafka.topic.command-results:invoices.topic.command-results}")
    private String commandResults;

    @Value("${kafka.topic.snapshots:invoices.topic.snapshots}")
    private String snapshots;
}
