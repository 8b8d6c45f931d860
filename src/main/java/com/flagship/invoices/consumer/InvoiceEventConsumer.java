package com.flagship.invoices.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.flagship.invoices.invoice.event.EventPayload;
import com.flagship.invoices.invoice.event.InvoiceEvent;
import com.flagship.invoices.observability.InvoiceMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;

/**
 * Kafka consumer for the invoice events topic.
 *
 * This consumer:
 * 1. Reads the envelope fields (origin id, version, command id)
 * 2. Deduplicates on (origin id, version) for its consumer group
 * 3. Hands the event to {@link InvoiceEventHandler}
 * 4. Acknowledges only after the processed record is committed
 *
 * Unreadable records are acknowledged and skipped. Events of a type this build does
 * not know are recorded as skipped.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class InvoiceEventConsumer {

    static final String CONSUMER_GROUP = "invoice-event-consumer";

    private final IdempotentEventProcessor eventProcessor;
    private final InvoiceEventHandler eventHandler;
    private final InvoiceMetrics metrics;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.events:invoices.topic.events}",
        groupId = CONSUMER_GROUP
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received event: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        Envelope envelope = parseEnvelope(record.value());
        if (envelope == null) {
            log.warn("Could not parse event, acknowledging to skip: offset={}", record.offset());
            ack.acknowledge();
            return;
        }

        try {
            EventPayload payload = parsePayload(envelope);
            if (payload == null) {
                eventProcessor.skipEvent(envelope.originId, envelope.version, envelope.eventType,
                        envelope.commandId, CONSUMER_GROUP, "Unknown event type");
                ack.acknowledge();
                return;
            }

            InvoiceEvent event = new InvoiceEvent(envelope.version, envelope.timestamp, envelope.commandId, payload);
            boolean processed = eventProcessor.processEvent(
                envelope.originId, envelope.version, payload.eventType(), envelope.commandId, CONSUMER_GROUP,
                () -> {
                    String action = eventHandler.handle(envelope.originId, event);
                    log.info("Handled {} v{} for invoice {}: {}",
                            payload.eventType(), envelope.version, envelope.originId, action);
                }
            );

            ack.acknowledge();
            metrics.recordEventConsumed(payload.eventType(), processed);

        } catch (Exception e) {
            log.error("Error processing event at offset {}: {}", record.offset(), e.getMessage(), e);
            metrics.recordEventConsumeFailure(envelope.eventType, e.getClass().getSimpleName());
            // not acknowledged, redelivered
            throw e;
        }
    }

    private Envelope parseEnvelope(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            JsonNode payload = node.get("payload");
            return new Envelope(
                UUID.fromString(node.get("originId").asText()),
                node.get("version").asInt(),
                Instant.parse(node.get("timestamp").asText()),
                UUID.fromString(node.get("commandId").asText()),
                payload.path("type").asText("Unknown"),
                payload
            );
        } catch (Exception e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    /**
     * @return null if the payload has a type this consumer does not know
     */
    private EventPayload parsePayload(Envelope envelope) {
        try {
            return objectMapper.treeToValue(envelope.payload, EventPayload.class);
        } catch (InvalidTypeIdException e) {
            log.debug("Unknown event type {}, skipping", envelope.eventType);
            return null;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unreadable " + envelope.eventType + " payload", e);
        }
    }

    private record Envelope(UUID originId, int version, Instant timestamp, UUID commandId,
                            String eventType, JsonNode payload) {}
}
