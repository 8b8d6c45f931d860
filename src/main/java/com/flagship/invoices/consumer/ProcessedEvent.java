package com.flagship.invoices.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record of an invoice event handled by a consumer group.
 *
 * An event is identified by (originId, version): versions are unique per invoice,
 * so a re-delivered record always maps to the same key.
 */
@Value
public class ProcessedEvent {
    UUID originId;
    int version;
    String consumerGroup;
    String eventType;
    UUID commandId;
    Instant processedAt;
    ProcessingResult result;
    String note;

    public enum ProcessingResult {
        SUCCESS,    // handler ran
        SKIPPED     // not relevant to this consumer
    }

    public static ProcessedEvent success(UUID originId, int version, String consumerGroup,
                                         String eventType, UUID commandId) {
        return new ProcessedEvent(
            originId,
            version,
            consumerGroup,
            eventType,
            commandId,
            Instant.now(),
            ProcessingResult.SUCCESS,
            null
        );
    }

    public static ProcessedEvent skipped(UUID originId, int version, String consumerGroup,
                                         String eventType, UUID commandId, String reason) {
        return new ProcessedEvent(
            originId,
            version,
            consumerGroup,
            eventType,
            commandId,
            Instant.now(),
            ProcessingResult.SKIPPED,
            reason
        );
    }
}
