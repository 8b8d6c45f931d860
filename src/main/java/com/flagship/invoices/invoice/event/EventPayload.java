package com.flagship.invoices.invoice.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * What changed, one state change per event.
 *
 * Closed set. The reducer and the downstream handlers consume it through
 * {@link Visitor}; the "type" property carries the variant on the wire.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = EventPayload.InvoiceCreated.class, name = "InvoiceCreated"),
    @JsonSubTypes.Type(value = EventPayload.LineItemAdded.class, name = "LineItemAdded"),
    @JsonSubTypes.Type(value = EventPayload.LineItemRemoved.class, name = "LineItemRemoved"),
    @JsonSubTypes.Type(value = EventPayload.PaymentReceived.class, name = "PaymentReceived"),
    @JsonSubTypes.Type(value = EventPayload.InvoiceDeleted.class, name = "InvoiceDeleted")
})
public sealed interface EventPayload
        permits EventPayload.InvoiceCreated, EventPayload.LineItemAdded, EventPayload.LineItemRemoved,
                EventPayload.PaymentReceived, EventPayload.InvoiceDeleted {

    <R> R accept(Visitor<R> visitor);

    /**
     * Event type name for routing/filtering, same as the "type" property.
     */
    default String eventType() {
        return getClass().getSimpleName();
    }

    interface Visitor<R> {
        R visitInvoiceCreated(InvoiceCreated event);

        R visitLineItemAdded(LineItemAdded event);

        R visitLineItemRemoved(LineItemRemoved event);

        R visitPaymentReceived(PaymentReceived event);

        R visitInvoiceDeleted(InvoiceDeleted event);
    }

    record InvoiceCreated(String customerName,
                          String customerEmail,
                          LocalDate issueDate,
                          LocalDate dueDate) implements EventPayload {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInvoiceCreated(this);
        }
    }

    record LineItemAdded(String description,
                         BigDecimal quantity,
                         BigDecimal price) implements EventPayload {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLineItemAdded(this);
        }
    }

    record LineItemRemoved(int index) implements EventPayload {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLineItemRemoved(this);
        }
    }

    /**
     * The total is the invoice total when payment was recorded. Informational only,
     * the live total is always derived from the line items.
     */
    record PaymentReceived(BigDecimal total) implements EventPayload {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPaymentReceived(this);
        }
    }

    record InvoiceDeleted() implements EventPayload {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInvoiceDeleted(this);
        }
    }
}
