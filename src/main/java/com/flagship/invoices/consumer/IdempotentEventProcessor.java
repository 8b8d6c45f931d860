package com.flagship.invoices.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Runs a handler at most once per (originId, version, consumer group).
 *
 * The handler and the processed record commit together. If the handler throws,
 * nothing is recorded and the exception propagates so the record is redelivered.
 *
 * <pre>
 * eventProcessor.processEvent(originId, version, eventType, commandId, consumerGroup,
 *     () -> handler.handle(originId, event));
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;

    /**
     * @return true if the handler ran, false if the event was a duplicate
     */
    @Transactional
    public boolean processEvent(UUID originId, int version, String eventType, UUID commandId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(originId, version, consumerGroup)) {
            log.info("Event {}@{} already processed by consumer group {}, skipping",
                    originId, version, consumerGroup);
            return false;
        }

        try {
            handler.run();
        } catch (RuntimeException e) {
            log.error("Failed to process event {}@{} by consumer group {}: {}",
                    originId, version, consumerGroup, e.getMessage(), e);
            throw e;
        }

        repository.save(ProcessedEventEntity.fromDomain(
            ProcessedEvent.success(originId, version, consumerGroup, eventType, commandId)
        ));
        log.debug("Processed event {}@{} by consumer group {}", originId, version, consumerGroup);
        return true;
    }

    /**
     * Records an event as seen without handling it, so it is not considered again.
     */
    @Transactional
    public void skipEvent(UUID originId, int version, String eventType, UUID commandId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(originId, version, consumerGroup)) {
            return;
        }

        repository.save(ProcessedEventEntity.fromDomain(
            ProcessedEvent.skipped(originId, version, consumerGroup, eventType, commandId, reason)
        ));
        log.debug("Skipped event {}@{} by consumer group {}: {}", originId, version, consumerGroup, reason);
    }

    @Transactional(readOnly = true)
    public boolean isAlreadyProcessed(UUID originId, int version, String consumerGroup) {
        return repository.existsByOriginIdAndVersionAndConsumerGroup(originId, version, consumerGroup);
    }
}
