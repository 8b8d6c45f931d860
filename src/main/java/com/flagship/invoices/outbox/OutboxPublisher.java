package com.flagship.invoices.outbox;

import com.flagship.invoices.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Background publisher that drains the outbox into Kafka.
 *
 * Messages are sent synchronously in sequence order with their stored key, so
 * all records of one invoice reach the same partition in version order. If a
 * send fails, the remaining messages with that key are held back until the next
 * poll. Messages that reach the retry limit stay in the table as dead letters
 * and are no longer selected; later messages with the same key go ahead without them.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingMessages() {
        try {
            List<OutboxMessage> messages = outboxService.findUnpublishedMessages(maxRetries, batchSize);

            if (messages.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished outbox messages", messages.size());

            Set<String> blockedKeys = new HashSet<>();
            for (OutboxMessage message : messages) {
                if (blockedKeys.contains(message.getMessageKey())) {
                    continue;
                }
                if (!publishMessage(message)) {
                    blockedKeys.add(message.getMessageKey());
                }
            }

        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    /**
     * @return true if the message was acknowledged by the broker
     */
    private boolean publishMessage(OutboxMessage message) {
        try {
            SendResult<String, String> result = kafkaTemplate
                    .send(message.getTopic(), message.getMessageKey(), message.getPayload())
                    .get();

            log.debug("Published outbox message: id={}, topic={}, partition={}, offset={}, type={}",
                    message.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    message.getMessageType());

            outboxService.markPublished(message.getId());
            outboxMetrics.recordMessagePublished(message.getMessageType());
            return true;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(message, "Interrupted while publishing");
            return false;
        } catch (Exception e) {
            log.error("Failed to publish outbox message: id={}, type={}, error={}",
                    message.getId(), message.getMessageType(), e.getMessage());
            recordFailure(message, e.getMessage());
            return false;
        }
    }

    /**
     * The failure that reaches the retry limit turns the message into a dead letter;
     * it is counted once here and never selected again.
     */
    private void recordFailure(OutboxMessage message, String error) {
        int retryCount = outboxService.markFailed(message.getId(), error);
        outboxMetrics.recordMessagePublishFailed(message.getMessageType());
        if (retryCount >= maxRetries) {
            log.warn("Outbox message {} reached max retries ({}), left as dead letter. type={}, key={}",
                    message.getId(), maxRetries, message.getMessageType(), message.getMessageKey());
            outboxMetrics.recordMessageDeadLettered(message.getMessageType());
        }
    }

    /**
     * Runs one publishing pass immediately.
     */
    public void triggerPublish() {
        publishPendingMessages();
    }
}
