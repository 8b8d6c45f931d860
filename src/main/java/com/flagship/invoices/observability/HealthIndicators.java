package com.flagship.invoices.observability;

import com.flagship.invoices.outbox.OutboxMessageRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Actuator health indicators for the invoice service's dependencies.
 */
public class HealthIndicators {

    private static final String REDIS_FALLBACK_NOTE = "Command idempotency falls back to the database without Redis";

    /**
     * Reports the outbox as a queue: how much is waiting, how long the oldest message
     * has waited, and how many messages gave up.
     *
     * DOWN once the oldest message is older than the stall threshold, since nothing
     * behind it with the same key can be published either.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final Duration STALL_THRESHOLD = Duration.ofMinutes(5);

        private final OutboxMessageRepository outboxRepository;
        private final int maxRetries;

        public OutboxHealthIndicator(OutboxMessageRepository outboxRepository,
                                     @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
            this.outboxRepository = outboxRepository;
            this.maxRetries = maxRetries;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();
                long deadLetters = outboxRepository.countByRetryCountGreaterThanEqual(maxRetries);
                Duration oldestAge = outboxRepository.findOldestPendingCreatedAt(maxRetries)
                        .map(createdAt -> Duration.between(createdAt, Instant.now()))
                        .orElse(Duration.ZERO);

                Health.Builder builder;
                if (oldestAge.compareTo(STALL_THRESHOLD) > 0) {
                    builder = Health.down();
                } else if (backlogSize >= BACKLOG_WARNING_THRESHOLD || deadLetters > 0) {
                    builder = Health.status("WARNING");
                } else {
                    builder = Health.up();
                }

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("oldestMessageAgeSeconds", oldestAge.toSeconds())
                        .withDetail("deadLetters", deadLetters)
                        .build();

            } catch (Exception e) {
                return Health.down(e).build();
            }
        }
    }

    /**
     * Redis being down degrades the service but does not take it out.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return Health.status("DEGRADED")
                            .withDetail("error", "No connection factory configured")
                            .withDetail("note", REDIS_FALLBACK_NOTE)
                            .build();
                }

                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    if ("PONG".equals(result)) {
                        return Health.up()
                                .withDetail("response", result)
                                .build();
                    }
                    return Health.down()
                            .withDetail("response", result != null ? result : "null")
                            .build();
                }

            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", REDIS_FALLBACK_NOTE)
                        .build();
            }
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
