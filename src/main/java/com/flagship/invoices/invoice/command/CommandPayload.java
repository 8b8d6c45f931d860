package com.flagship.invoices.invoice.command;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.flagship.invoices.invoice.LineItem;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * The change a command asks for.
 *
 * Closed set, consumed through {@link Visitor} by {@link CommandDispatcher}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = CommandPayload.CreateInvoice.class, name = "CreateInvoice"),
    @JsonSubTypes.Type(value = CommandPayload.AddLineItem.class, name = "AddLineItem"),
    @JsonSubTypes.Type(value = CommandPayload.RemoveLineItem.class, name = "RemoveLineItem"),
    @JsonSubTypes.Type(value = CommandPayload.PayInvoice.class, name = "PayInvoice"),
    @JsonSubTypes.Type(value = CommandPayload.DeleteInvoice.class, name = "DeleteInvoice")
})
public sealed interface CommandPayload
        permits CommandPayload.CreateInvoice, CommandPayload.AddLineItem, CommandPayload.RemoveLineItem,
                CommandPayload.PayInvoice, CommandPayload.DeleteInvoice {

    <R> R accept(Visitor<R> visitor);

    /**
     * Command type name, used as a metric tag.
     */
    default String commandType() {
        return getClass().getSimpleName();
    }

    interface Visitor<R> {
        R visitCreateInvoice(CreateInvoice command);

        R visitAddLineItem(AddLineItem command);

        R visitRemoveLineItem(RemoveLineItem command);

        R visitPayInvoice(PayInvoice command);

        R visitDeleteInvoice(DeleteInvoice command);
    }

    record CreateInvoice(String customerName,
                         String customerEmail,
                         LocalDate issueDate,
                         LocalDate dueDate,
                         List<LineItem> lineItems) implements CommandPayload {

        public CreateInvoice {
            lineItems = lineItems == null ? List.of() : List.copyOf(lineItems);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCreateInvoice(this);
        }
    }

    record AddLineItem(String description,
                       BigDecimal quantity,
                       BigDecimal price) implements CommandPayload {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAddLineItem(this);
        }
    }

    record RemoveLineItem(int index) implements CommandPayload {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRemoveLineItem(this);
        }
    }

    record PayInvoice() implements CommandPayload {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPayInvoice(this);
        }
    }

    record DeleteInvoice() implements CommandPayload {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDeleteInvoice(this);
        }
    }
}
