package com.flagship.invoices.invoice.command;

import com.flagship.invoices.invoice.InvoiceError;
import com.flagship.invoices.invoice.InvoiceSnapshot;
import com.flagship.invoices.invoice.SnapshotReducer;
import com.flagship.invoices.invoice.event.EventPayload;
import com.flagship.invoices.invoice.event.InvoiceEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Executes a command against a snapshot.
 *
 * Steps:
 * 1. Validate the expected version against the snapshot version
 * 2. Dispatch the payload against the invoice as it is in the snapshot
 * 3. Number the resulting events oldVersion+1, oldVersion+2, ... and fold them
 *    into the snapshot one by one
 *
 * Pure: no I/O and no clock (the caller passes the timestamp), so the same inputs
 * always give the same result and concurrent calls need no synchronization.
 * Either every event of a command is produced or none is.
 *
 * Not safe against two commands for the same invoice computed from the same
 * snapshot: callers serialize commands per origin id (row lock or partition).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommandProcessor {

    private final CommandDispatcher dispatcher;
    private final SnapshotReducer reducer;

    /**
     * Processes one command. Domain problems come back as a Failure outcome, this
     * method does not throw for them.
     *
     * @param timestamp Stamped on every event the command produces
     * @param command Command to execute
     * @param snapshot Latest committed snapshot for command.originId
     * @return Success with the events and both snapshots, or Failure with the cause
     */
    public CommandResult process(Instant timestamp, InvoiceCommand command, InvoiceSnapshot snapshot) {
        Optional<InvoiceError> versionError = snapshot.validateVersion(command.getExpectedVersion());
        if (versionError.isPresent()) {
            log.debug("Command {} rejected: expected version {}, snapshot is at {}",
                    command.getCommandId(), command.getExpectedVersion(), snapshot.getVersion());
            return CommandResult.failure(command, versionError.get());
        }

        CommandDecision decision = dispatcher.dispatch(command.getPayload(), snapshot.getInvoice());
        if (decision.isRejected()) {
            return CommandResult.failure(command, decision.getError());
        }

        List<InvoiceEvent> events = new ArrayList<>();
        InvoiceSnapshot current = snapshot;
        for (EventPayload payload : decision.getEvents()) {
            int version = snapshot.getVersion() + events.size() + 1;
            InvoiceEvent event = new InvoiceEvent(version, timestamp, command.getCommandId(), payload);
            current = reducer.handle(current, event);
            events.add(event);
        }

        log.debug("Command {} produced {} event(s), version {} -> {}",
                command.getCommandId(), events.size(), snapshot.getVersion(), current.getVersion());
        return CommandResult.success(command, events, snapshot, current);
    }
}
