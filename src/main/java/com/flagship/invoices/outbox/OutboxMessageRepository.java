package com.flagship.invoices.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OutboxMessageRepository extends JpaRepository<OutboxMessageEntity, UUID> {

    /**
     * Unpublished messages still under the retry limit, in write order. Sequence order
     * (not created_at) keeps the events of one command in version order even when they
     * share a timestamp. Dead letters are skipped so they never fill the batch.
     */
    @Query(value = """
        SELECT * FROM outbox_messages
        WHERE published_at IS NULL
          AND retry_count < :maxRetries
        ORDER BY sequence_number ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxMessageEntity> findUnpublishedForUpdate(@Param("maxRetries") int maxRetries,
                                                       @Param("limit") int limit);

    /**
     * Messages for one key (origin id or command id), in write order.
     */
    List<OutboxMessageEntity> findByMessageKeyOrderBySequenceNumberAsc(String messageKey);

    List<OutboxMessageEntity> findByTopicAndMessageKeyOrderBySequenceNumberAsc(String topic, String messageKey);

    @Query("SELECT COUNT(m) FROM OutboxMessageEntity m WHERE m.publishedAt IS NULL")
    long countUnpublished();

    long countByRetryCountGreaterThanEqual(int retryCount);

    /**
     * Creation time of the oldest message the publisher will still try.
     */
    @Query("""
        SELECT MIN(m.createdAt) FROM OutboxMessageEntity m
        WHERE m.publishedAt IS NULL AND m.retryCount < :maxRetries
        """)
    Optional<Instant> findOldestPendingCreatedAt(@Param("maxRetries") int maxRetries);
}
