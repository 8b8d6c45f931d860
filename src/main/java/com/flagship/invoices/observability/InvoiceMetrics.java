package com.flagship.invoices.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for invoice commands and events.
 *
 * Metrics exposed:
 * - invoice.commands: commands executed, tagged by command type and outcome
 * - invoice.commands.rejected: rejected commands, tagged by error type
 * - invoice.events.emitted: events appended, tagged by event type
 * - invoice.commands.duplicate: commands answered from the idempotency store
 * - invoice.command.duration: execution latency per command type
 * - invoice.events.consumed: events handled downstream, tagged by event type and whether new
 */
@Component
public class InvoiceMetrics {

    private final MeterRegistry registry;
    private final Counter duplicateCommands;

    public InvoiceMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.duplicateCommands = Counter.builder("invoice.commands.duplicate")
                .description("Commands answered from the idempotency store")
                .register(registry);
    }

    public void recordCommand(String commandType, boolean succeeded, Duration duration) {
        String outcome = succeeded ? "success" : "failure";
        registry.counter("invoice.commands",
                "command_type", sanitizeTag(commandType),
                "outcome", outcome
        ).increment();
        Timer.builder("invoice.command.duration")
                .description("Time taken to execute an invoice command")
                .tag("command_type", sanitizeTag(commandType))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(duration);
    }

    public void recordRejection(String errorType) {
        registry.counter("invoice.commands.rejected",
                "error_type", sanitizeTag(errorType)
        ).increment();
    }

    public void recordEventEmitted(String eventType) {
        registry.counter("invoice.events.emitted",
                "event_type", sanitizeTag(eventType)
        ).increment();
    }

    public void recordDuplicateCommand() {
        duplicateCommands.increment();
    }

    public void recordEventConsumed(String eventType, boolean wasNew) {
        registry.counter("invoice.events.consumed",
                "event_type", sanitizeTag(eventType),
                "was_new", String.valueOf(wasNew)
        ).increment();
    }

    public void recordEventConsumeFailure(String eventType, String error) {
        registry.counter("invoice.events.consume.failure",
                "event_type", sanitizeTag(eventType),
                "error", sanitizeTag(error)
        ).increment();
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
