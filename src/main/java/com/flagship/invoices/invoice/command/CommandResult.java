package com.flagship.invoices.invoice.command;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.flagship.invoices.invoice.InvoiceError;
import com.flagship.invoices.invoice.InvoiceSnapshot;
import com.flagship.invoices.invoice.event.InvoiceEvent;
import lombok.Value;

import java.util.List;
import java.util.UUID;
import java.util.function.Function;

/**
 * Terminal result of processing one command, published keyed by command id.
 */
@Value
public class CommandResult {
    UUID originId;
    UUID commandId;
    Outcome outcome;

    public static CommandResult success(InvoiceCommand command, List<InvoiceEvent> events,
                                        InvoiceSnapshot oldSnapshot, InvoiceSnapshot newSnapshot) {
        return new CommandResult(
            command.getOriginId(),
            command.getCommandId(),
            new Success(events, oldSnapshot, newSnapshot)
        );
    }

    public static CommandResult failure(InvoiceCommand command, InvoiceError cause) {
        return new CommandResult(
            command.getOriginId(),
            command.getCommandId(),
            new Failure(cause)
        );
    }

    public boolean succeeded() {
        return outcome instanceof Success;
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "status")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = Success.class, name = "SUCCESS"),
        @JsonSubTypes.Type(value = Failure.class, name = "FAILURE")
    })
    public sealed interface Outcome permits Success, Failure {

        <R> R fold(Function<Success, R> onSuccess, Function<Failure, R> onFailure);
    }

    /**
     * newSnapshot.version == oldSnapshot.version + events.size()
     */
    public record Success(List<InvoiceEvent> events,
                          InvoiceSnapshot oldSnapshot,
                          InvoiceSnapshot newSnapshot) implements Outcome {

        public Success {
            events = List.copyOf(events);
        }

        @Override
        public <R> R fold(Function<Success, R> onSuccess, Function<Failure, R> onFailure) {
            return onSuccess.apply(this);
        }
    }

    /**
     * Nothing was emitted and the stored snapshot is untouched.
     */
    public record Failure(InvoiceError cause) implements Outcome {
        @Override
        public <R> R fold(Function<Success, R> onSuccess, Function<Failure, R> onFailure) {
            return onFailure.apply(this);
        }
    }
}
