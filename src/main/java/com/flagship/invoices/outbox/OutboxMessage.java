package com.flagship.invoices.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A Kafka record waiting in the outbox.
 *
 * Written in the same transaction as the snapshot and the event log, published
 * afterwards by {@link OutboxPublisher} in sequence order.
 */
@Value
public class OutboxMessage {
    UUID id;
    String topic;
    String messageKey;         // origin id, or command id for command results
    String messageType;        // e.g. "LineItemAdded", "InvoiceSnapshot", "CommandResult"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null if not yet published
    int retryCount;
    String lastError;
    Long sequenceNumber;       // assigned by the database

    public static OutboxMessage create(String topic, String messageKey, String messageType, String payload) {
        return new OutboxMessage(
            UUID.randomUUID(),
            topic,
            messageKey,
            messageType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
