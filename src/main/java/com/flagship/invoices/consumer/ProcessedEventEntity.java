package com.flagship.invoices.consumer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the processed_events table.
 */
@Entity
@Table(name = "processed_events")
@IdClass(ProcessedEventKey.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ProcessedEventEntity {

    @Id
    @Column(name = "origin_id", nullable = false, updatable = false)
    private UUID originId;

    @Id
    @Column(name = "version", nullable = false, updatable = false)
    private int version;

    @Id
    @Column(name = "consumer_group", nullable = false, updatable = false, length = 100)
    private String consumerGroup;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "command_id")
    private UUID commandId;

    @Column(name = "processed_at", nullable = false)
    private Instant processedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_result", nullable = false, length = 50)
    private ProcessedEvent.ProcessingResult processingResult;

    @Column(name = "note", columnDefinition = "TEXT")
    private String note;

    public static ProcessedEventEntity fromDomain(ProcessedEvent event) {
        return new ProcessedEventEntity(
            event.getOriginId(),
            event.getVersion(),
            event.getConsumerGroup(),
            event.getEventType(),
            event.getCommandId(),
            event.getProcessedAt(),
            event.getResult(),
            event.getNote()
        );
    }

    public ProcessedEvent toDomain() {
        return new ProcessedEvent(
            this.originId,
            this.version,
            this.consumerGroup,
            this.eventType,
            this.commandId,
            this.processedAt,
            this.processingResult,
            this.note
        );
    }
}
