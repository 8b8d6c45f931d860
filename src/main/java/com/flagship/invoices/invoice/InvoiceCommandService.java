package com.flagship.invoices.invoice;

import com.flagship.invoices.config.TopicNames;
import com.flagship.invoices.eventlog.EventLogService;
import com.flagship.invoices.invoice.command.CommandProcessor;
import com.flagship.invoices.invoice.command.CommandResult;
import com.flagship.invoices.invoice.command.IdempotencyService;
import com.flagship.invoices.invoice.command.InvoiceCommand;
import com.flagship.invoices.invoice.event.InvoiceEvent;
import com.flagship.invoices.invoice.event.InvoiceEventEnvelope;
import com.flagship.invoices.observability.CorrelationContext;
import com.flagship.invoices.observability.InvoiceMetrics;
import com.flagship.invoices.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Executes invoice commands against the stored state.
 *
 * One database transaction per command:
 * 1. Lock the invoice's snapshot row (single writer per invoice)
 * 2. Return the stored result if the command id was already executed
 * 3. Run the command processor against the locked snapshot
 * 4. On success: advance the snapshot, append the events, queue events and snapshot in the outbox
 * 5. Always: store the result and queue it on the command-results topic
 *
 * Either all of it commits or none of it does. Nothing reaches Kafka before commit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoiceCommandService {

    static final String SNAPSHOT_MESSAGE_TYPE = "InvoiceSnapshot";
    static final String RESULT_MESSAGE_TYPE = "CommandResult";

    private final CommandProcessor processor;
    private final InvoicePersistenceService persistenceService;
    private final EventLogService eventLog;
    private final IdempotencyService idempotencyService;
    private final OutboxService outboxService;
    private final TopicNames topics;
    private final InvoiceMetrics metrics;

    /**
     * @return the command's result; the stored one when the command id is a repeat
     * @throws CorruptEventLogException if the stored state cannot absorb the produced events
     */
    @Transactional
    public CommandResult execute(InvoiceCommand command) {
        long startTime = System.currentTimeMillis();
        String commandType = command.getPayload().commandType();
        CorrelationContext.putCommand(command.getOriginId(), command.getCommandId());

        try {
            InvoiceSnapshot snapshot = persistenceService.loadForUpdate(command.getOriginId());

            Optional<CommandResult> previous = idempotencyService.findResult(command.getCommandId());
            if (previous.isPresent()) {
                log.info("Command {} already executed, returning stored result", commandType);
                metrics.recordDuplicateCommand();
                return previous.get();
            }

            CommandResult result = processor.process(Instant.now(), command, snapshot);

            result.getOutcome().fold(
                success -> {
                    persist(command.getOriginId(), success);
                    return null;
                },
                failure -> {
                    String errorType = failure.cause().getClass().getSimpleName();
                    log.warn("Command {} rejected at version {}: {}", commandType, snapshot.getVersion(), failure.cause());
                    metrics.recordRejection(errorType);
                    return null;
                }
            );

            String resultJson = idempotencyService.storeResult(result);
            outboxService.saveMessage(topics.getCommandResults(), command.getCommandId().toString(),
                    RESULT_MESSAGE_TYPE, result);
            cacheAfterCommit(command.getCommandId(), resultJson);

            metrics.recordCommand(commandType, result.succeeded(),
                    Duration.ofMillis(System.currentTimeMillis() - startTime));
            return result;

        } catch (CorruptEventLogException e) {
            log.error("Event log for invoice {} is corrupt: {}", command.getOriginId(), e.getMessage());
            throw e;
        } finally {
            CorrelationContext.clearCommand();
        }
    }

    @Transactional(readOnly = true)
    public InvoiceSnapshot getSnapshot(UUID originId) {
        return persistenceService.load(originId);
    }

    @Transactional(readOnly = true)
    public Optional<CommandResult> getResult(UUID commandId) {
        return idempotencyService.findResult(commandId);
    }

    private void persist(UUID originId, CommandResult.Success success) {
        persistenceService.save(originId, success.oldSnapshot(), success.newSnapshot());
        eventLog.append(originId, success.events());

        String key = originId.toString();
        for (InvoiceEvent event : success.events()) {
            String eventType = event.getPayload().eventType();
            outboxService.saveMessage(topics.getEvents(), key, eventType, InvoiceEventEnvelope.of(originId, event));
            metrics.recordEventEmitted(eventType);
        }
        outboxService.saveMessage(topics.getSnapshots(), key, SNAPSHOT_MESSAGE_TYPE, success.newSnapshot());

        log.info("Invoice advanced from version {} to {} ({} event(s))",
                success.oldSnapshot().getVersion(), success.newSnapshot().getVersion(), success.events().size());
    }

    private void cacheAfterCommit(UUID commandId, String resultJson) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            idempotencyService.cache(commandId, resultJson);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                idempotencyService.cache(commandId, resultJson);
            }
        });
    }
}
