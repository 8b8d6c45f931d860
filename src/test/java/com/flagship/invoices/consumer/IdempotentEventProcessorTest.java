package com.flagship.invoices.consumer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Idempotent event processing.
 *
 * These tests verify that:
 * - Events are handled exactly once per consumer group
 * - Duplicate deliveries are ignored
 * - A failed handler records nothing, so the event is retried
 * - Different consumer groups handle the same event independently
 */
@SpringBootTest
@Testcontainers
class IdempotentEventProcessorTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("invoices_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // Disable Kafka for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private IdempotentEventProcessor eventProcessor;

    @Autowired
    private ProcessedEventRepository repository;

    private static final String CONSUMER_GROUP = "test-consumer";
    private static final String EVENT_TYPE = "LineItemAdded";

    @BeforeEach
    void setUp() {
        repository.deleteAll();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("First delivery runs the handler, the second is ignored")
    void duplicateDeliveryIgnored() {
        printTestHeader("Duplicate Delivery");
        UUID originId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        boolean first = eventProcessor.processEvent(originId, 2, EVENT_TYPE, UUID.randomUUID(), CONSUMER_GROUP,
                calls::incrementAndGet);
        boolean second = eventProcessor.processEvent(originId, 2, EVENT_TYPE, UUID.randomUUID(), CONSUMER_GROUP,
                calls::incrementAndGet);

        assertTrue(first);
        assertFalse(second);
        assertEquals(1, calls.get());
        assertTrue(eventProcessor.isAlreadyProcessed(originId, 2, CONSUMER_GROUP));
        printSuccess("Handler ran once");
    }

    @Test
    @DisplayName("Versions of one invoice are distinct events")
    void versionsAreDistinct() {
        UUID originId = UUID.randomUUID();

        assertTrue(eventProcessor.processEvent(originId, 1, "InvoiceCreated", UUID.randomUUID(), CONSUMER_GROUP, () -> { }));
        assertTrue(eventProcessor.processEvent(originId, 2, EVENT_TYPE, UUID.randomUUID(), CONSUMER_GROUP, () -> { }));

        List<ProcessedEventEntity> processed =
                repository.findByOriginIdAndConsumerGroupOrderByVersionAsc(originId, CONSUMER_GROUP);
        assertEquals(List.of(1, 2), processed.stream().map(ProcessedEventEntity::getVersion).toList());
    }

    @Test
    @DisplayName("Failed handler records nothing and the event can be retried")
    void failedHandlerIsRetried() {
        printTestHeader("Failed Handler");
        UUID originId = UUID.randomUUID();

        assertThrows(IllegalStateException.class, () ->
                eventProcessor.processEvent(originId, 1, EVENT_TYPE, UUID.randomUUID(), CONSUMER_GROUP, () -> {
                    throw new IllegalStateException("Downstream unavailable");
                }));
        assertFalse(eventProcessor.isAlreadyProcessed(originId, 1, CONSUMER_GROUP));

        boolean retried = eventProcessor.processEvent(originId, 1, EVENT_TYPE, UUID.randomUUID(), CONSUMER_GROUP, () -> { });

        assertTrue(retried);
        printSuccess("Retry succeeded after failure");
    }

    @Test
    @DisplayName("Each consumer group handles the event once")
    void consumerGroupsAreIndependent() {
        UUID originId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        eventProcessor.processEvent(originId, 1, EVENT_TYPE, UUID.randomUUID(), "group-a", calls::incrementAndGet);
        eventProcessor.processEvent(originId, 1, EVENT_TYPE, UUID.randomUUID(), "group-b", calls::incrementAndGet);

        assertEquals(2, calls.get());
        assertEquals(1, repository.countByConsumerGroup("group-a"));
        assertEquals(1, repository.countByConsumerGroup("group-b"));
    }

    @Test
    @DisplayName("Skipped event is recorded as SKIPPED and not handled later")
    void skippedEvent() {
        UUID originId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        eventProcessor.skipEvent(originId, 1, "InvoiceArchived", UUID.randomUUID(), CONSUMER_GROUP, "Unknown event type");
        boolean handled = eventProcessor.processEvent(originId, 1, "InvoiceArchived", UUID.randomUUID(), CONSUMER_GROUP,
                calls::incrementAndGet);

        assertFalse(handled);
        assertEquals(0, calls.get());
        ProcessedEvent recorded = repository.findByOriginIdAndConsumerGroupOrderByVersionAsc(originId, CONSUMER_GROUP)
                .get(0).toDomain();
        assertEquals(ProcessedEvent.ProcessingResult.SKIPPED, recorded.getResult());
        assertEquals("Unknown event type", recorded.getNote());
    }

    @Test
    @DisplayName("Concurrent duplicate deliveries run the handler at most once")
    void concurrentDuplicates() throws Exception {
        printTestHeader("Concurrent Duplicates");
        UUID originId = UUID.randomUUID();
        AtomicInteger committed = new AtomicInteger();
        int threads = 5;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    if (eventProcessor.processEvent(originId, 1, EVENT_TYPE, UUID.randomUUID(), CONSUMER_GROUP, () -> { })) {
                        committed.incrementAndGet();
                    }
                } catch (Exception e) {
                    // losers hit the primary key and roll back
                    System.out.println("Duplicate rejected: " + e.getClass().getSimpleName());
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));

        assertEquals(1, committed.get());
        assertEquals(1, repository.countByConsumerGroup(CONSUMER_GROUP));
        printSuccess("Exactly one delivery committed");
    }
}
