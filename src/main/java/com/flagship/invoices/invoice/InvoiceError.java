package com.flagship.invoices.invoice;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Closed set of reasons a command can be rejected.
 *
 * Errors are values, not exceptions: they travel inside
 * {@link com.flagship.invoices.invoice.command.CommandResult.Failure}.
 * Consumers handle them through {@link Visitor}, so adding a variant breaks
 * every consumer at compile time until it is handled.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = InvoiceError.VersionConflict.class, name = "VersionConflict"),
    @JsonSubTypes.Type(value = InvoiceError.LineItemDoesNotExist.class, name = "LineItemDoesNotExist"),
    @JsonSubTypes.Type(value = InvoiceError.InvalidState.class, name = "InvalidState")
})
public sealed interface InvoiceError
        permits InvoiceError.VersionConflict, InvoiceError.LineItemDoesNotExist, InvoiceError.InvalidState {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitVersionConflict(VersionConflict error);

        R visitLineItemDoesNotExist(LineItemDoesNotExist error);

        R visitInvalidState(InvalidState error);
    }

    /**
     * The command was built against a version the issuer no longer holds.
     * Never retried by the service; the issuer re-reads and resubmits.
     */
    record VersionConflict(int expectedVersion, int actualVersion) implements InvoiceError {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVersionConflict(this);
        }
    }

    record LineItemDoesNotExist(int index) implements InvoiceError {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLineItemDoesNotExist(this);
        }
    }

    /**
     * The invoice is not in a state that allows the command
     * (e.g. creating it twice, or changing one that was never created).
     */
    record InvalidState(String reason) implements InvoiceError {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInvalidState(this);
        }
    }
}
