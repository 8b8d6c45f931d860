package com.flagship.invoices.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used in log lines.
 *
 * The correlation id comes from the X-Correlation-ID header (or is generated) on
 * the HTTP path, and from the record key on the Kafka path.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ORIGIN_ID_MDC_KEY = "originId";
    public static final String COMMAND_ID_MDC_KEY = "commandId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Gets the current correlation ID, or generates a new one if not set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Puts the command's identifiers into the MDC for the duration of its execution.
     */
    public static void putCommand(UUID originId, UUID commandId) {
        MDC.put(ORIGIN_ID_MDC_KEY, String.valueOf(originId));
        MDC.put(COMMAND_ID_MDC_KEY, String.valueOf(commandId));
    }

    public static void clearCommand() {
        MDC.remove(ORIGIN_ID_MDC_KEY);
        MDC.remove(COMMAND_ID_MDC_KEY);
    }
}
