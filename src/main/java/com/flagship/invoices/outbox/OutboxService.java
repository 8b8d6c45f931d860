package com.flagship.invoices.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Writes Kafka records to the outbox inside the caller's transaction.
 *
 * Nothing is sent to Kafka here. A command that commits is guaranteed to have
 * its events, snapshot and result queued; a rolled back command queues nothing.
 * {@link OutboxPublisher} drains the table.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxMessageRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Queues a message within the current transaction.
     *
     * @param topic destination topic
     * @param key Kafka record key (origin id for events and snapshots, command id for results)
     * @param messageType type label, e.g. "InvoiceCreated"
     * @param payload object serialized to JSON
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxMessage saveMessage(String topic, String key, String messageType, Object payload) {
        String jsonPayload = serializePayload(payload);

        OutboxMessage message = OutboxMessage.create(topic, key, messageType, jsonPayload);
        OutboxMessageEntity saved = repository.save(OutboxMessageEntity.fromDomain(message));

        log.debug("Queued outbox message: topic={}, key={}, type={}", topic, key, messageType);

        return saved.toDomain();
    }

    /**
     * Uses SELECT FOR UPDATE SKIP LOCKED so several publishers can poll concurrently.
     * Messages that already failed {@code maxRetries} times are not returned.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxMessage> findUnpublishedMessages(int maxRetries, int limit) {
        return repository.findUnpublishedForUpdate(maxRetries, limit)
                .stream()
                .map(OutboxMessageEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID messageId) {
        repository.findById(messageId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
            log.debug("Marked outbox message {} as published", messageId);
        });
    }

    /**
     * @return the retry count after this failure, 0 if the message is gone
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int markFailed(UUID messageId, String errorMessage) {
        return repository.findById(messageId).map(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked outbox message {} as failed (retry #{}): {}",
                    messageId, entity.getRetryCount(), errorMessage);
            return entity.getRetryCount();
        }).orElse(0);
    }

    @Transactional(readOnly = true)
    public List<OutboxMessage> getMessagesForKey(String key) {
        return repository.findByMessageKeyOrderBySequenceNumberAsc(key)
                .stream()
                .map(OutboxMessageEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<OutboxMessage> getMessagesForKey(String topic, String key) {
        return repository.findByTopicAndMessageKeyOrderBySequenceNumberAsc(topic, key)
                .stream()
                .map(OutboxMessageEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize outbox payload", e);
        }
    }
}
