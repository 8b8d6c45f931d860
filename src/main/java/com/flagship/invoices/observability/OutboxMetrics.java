package com.flagship.invoices.observability;

import com.flagship.invoices.outbox.OutboxMessageRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox backlog gauges and publish counters.
 *
 * Gauges read cached values refreshed on a schedule so a Prometheus scrape
 * never hits the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxMessageRepository outboxRepository;
    private final MeterRegistry meterRegistry;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestMessageAgeSeconds = new AtomicLong(0);
    private final AtomicLong deadLetterCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("outbox.backlog.size", backlogSize, AtomicLong::get)
                .description("Number of unpublished messages in the outbox")
                .tag("status", "pending")
                .register(meterRegistry);

        Gauge.builder("outbox.backlog.age.seconds", oldestMessageAgeSeconds, AtomicLong::get)
                .description("Age of the oldest message still being retried, in seconds")
                .register(meterRegistry);

        Gauge.builder("outbox.messages.failed", deadLetterCount, AtomicLong::get)
                .description("Number of messages that exceeded max retry attempts")
                .tag("status", "failed")
                .register(meterRegistry);

        log.info("Outbox metrics registered with Micrometer");
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            long unpublished = outboxRepository.countUnpublished();
            backlogSize.set(unpublished);

            outboxRepository.findOldestPendingCreatedAt(maxRetries)
                    .ifPresentOrElse(
                            oldest -> {
                                long ageSeconds = Duration.between(oldest, Instant.now()).getSeconds();
                                oldestMessageAgeSeconds.set(Math.max(0, ageSeconds));
                            },
                            () -> oldestMessageAgeSeconds.set(0)
                    );

            long failed = outboxRepository.countByRetryCountGreaterThanEqual(maxRetries);
            deadLetterCount.set(failed);

            log.debug("Outbox metrics refreshed: backlog={}, oldestAge={}s, failed={}",
                    unpublished, oldestMessageAgeSeconds.get(), failed);

        } catch (Exception e) {
            log.warn("Failed to refresh outbox metrics: {}", e.getMessage());
        }
    }

    public long getBacklogSize() {
        return backlogSize.get();
    }

    public long getDeadLetterCount() {
        return deadLetterCount.get();
    }

    public void recordMessagePublished(String messageType) {
        meterRegistry.counter("outbox.messages.published",
                "message_type", messageType,
                "status", "success"
        ).increment();
    }

    public void recordMessagePublishFailed(String messageType) {
        meterRegistry.counter("outbox.messages.published",
                "message_type", messageType,
                "status", "failure"
        ).increment();
    }

    public void recordMessageDeadLettered(String messageType) {
        meterRegistry.counter("outbox.messages.dead_lettered",
                "message_type", messageType
        ).increment();
    }
}
