package com.flagship.invoices.invoice.command;

import com.flagship.invoices.invoice.InvoiceError;
import com.flagship.invoices.invoice.event.EventPayload;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Outcome of dispatching one payload: the ordered events to emit, or the reason
 * the command is rejected.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CommandDecision {

    /**
     * Events in the order they must be applied. Empty when rejected.
     */
    List<EventPayload> events;
    InvoiceError error;

    public static CommandDecision accept(EventPayload... events) {
        return accept(List.of(events));
    }

    public static CommandDecision accept(List<EventPayload> events) {
        return new CommandDecision(List.copyOf(events), null);
    }

    public static CommandDecision reject(InvoiceError error) {
        return new CommandDecision(List.of(), error);
    }

    public boolean isRejected() {
        return error != null;
    }
}
