package com.flagship.invoices.consumer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, ProcessedEventKey> {

    /**
     * Primary deduplication check.
     */
    boolean existsByOriginIdAndVersionAndConsumerGroup(UUID originId, int version, String consumerGroup);

    List<ProcessedEventEntity> findByOriginIdAndConsumerGroupOrderByVersionAsc(UUID originId, String consumerGroup);

    long countByConsumerGroup(String consumerGroup);

    /**
     * Retention cleanup.
     *
     * @return number of deleted records
     */
    @Modifying
    @Query("DELETE FROM ProcessedEventEntity e WHERE e.processedAt < :before")
    int deleteEventsProcessedBefore(@Param("before") Instant before);
}
