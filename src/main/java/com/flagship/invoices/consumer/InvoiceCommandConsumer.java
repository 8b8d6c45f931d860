package com.flagship.invoices.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.invoices.invoice.InvoiceCommandService;
import com.flagship.invoices.invoice.command.CommandResult;
import com.flagship.invoices.invoice.command.InvoiceCommand;
import com.flagship.invoices.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Kafka source of invoice commands.
 *
 * Records are keyed by origin id, so one partition (and one listener thread) owns
 * each invoice. The offset is committed after the command's transaction; a crash in
 * between redelivers the record and the idempotency store answers it.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class InvoiceCommandConsumer {

    static final String CONSUMER_GROUP = "invoice-command-consumer";

    private final InvoiceCommandService commandService;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.commands:invoices.topic.commands}",
        groupId = CONSUMER_GROUP
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        String correlationId = record.key() != null ? record.key() : CorrelationContext.generateCorrelationId();
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);

        try {
            InvoiceCommand command = parseCommand(record);
            if (command == null) {
                ack.acknowledge();
                return;
            }

            CommandResult result = commandService.execute(command);
            ack.acknowledge();

            log.info("Executed {} from partition {} offset {}: {}",
                    command.getPayload().commandType(), record.partition(), record.offset(),
                    result.succeeded() ? "SUCCESS" : "FAILURE");

        } catch (Exception e) {
            log.error("Error executing command at offset {}: {}", record.offset(), e.getMessage(), e);
            // not acknowledged, redelivered
            throw e;
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }

    /**
     * @return null for a record that can never be executed
     */
    private InvoiceCommand parseCommand(ConsumerRecord<String, String> record) {
        InvoiceCommand command;
        try {
            command = objectMapper.readValue(record.value(), InvoiceCommand.class);
        } catch (Exception e) {
            log.warn("Could not parse command, acknowledging to skip: offset={}, error={}",
                    record.offset(), e.getMessage());
            return null;
        }

        if (command.getOriginId() == null || command.getCommandId() == null || command.getPayload() == null) {
            log.warn("Command at offset {} lacks origin id, command id or payload, skipping", record.offset());
            return null;
        }
        if (record.key() != null && !record.key().equals(command.getOriginId().toString())) {
            log.warn("Command {} keyed {} but targets invoice {}",
                    command.getCommandId(), record.key(), command.getOriginId());
        }
        return command;
    }
}
