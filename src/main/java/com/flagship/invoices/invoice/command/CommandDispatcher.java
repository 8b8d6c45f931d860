package com.flagship.invoices.invoice.command;

import com.flagship.invoices.invoice.Invoice;
import com.flagship.invoices.invoice.InvoiceError;
import com.flagship.invoices.invoice.LineItem;
import com.flagship.invoices.invoice.event.EventPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Translates a command payload into the events it produces.
 *
 * Handlers only see the invoice as it was before the command started, never the
 * events the same command has already produced.
 *
 * Rules:
 * - CreateInvoice: InvoiceCreated, then one LineItemAdded per line item in input order
 * - AddLineItem: LineItemAdded
 * - RemoveLineItem: LineItemRemoved if the index exists, LineItemDoesNotExist otherwise
 * - PayInvoice: PaymentReceived with the current total
 * - DeleteInvoice: InvoiceDeleted
 *
 * CreateInvoice needs an invoice that does not exist yet, all other payloads need one
 * that does; otherwise the command is rejected with InvalidState. A line item without
 * a quantity or a price is rejected with InvalidState too, before anything reaches
 * the event log.
 */
@Component
@Slf4j
public class CommandDispatcher {

    /**
     * @param payload Requested change
     * @param invoice Current invoice, or null if it was never created
     */
    public CommandDecision dispatch(CommandPayload payload, Invoice invoice) {
        CommandDecision decision = payload.accept(new Handler(invoice));
        if (decision.isRejected()) {
            log.debug("{} rejected: {}", payload.commandType(), decision.getError());
        }
        return decision;
    }

    private static final class Handler implements CommandPayload.Visitor<CommandDecision> {

        private final Invoice invoice;

        private Handler(Invoice invoice) {
            this.invoice = invoice;
        }

        @Override
        public CommandDecision visitCreateInvoice(CommandPayload.CreateInvoice command) {
            if (invoice != null) {
                return CommandDecision.reject(new InvoiceError.InvalidState("Invoice already exists"));
            }
            for (LineItem lineItem : command.lineItems()) {
                if (!isPriced(lineItem.getQuantity(), lineItem.getPrice())) {
                    return unpriced();
                }
            }
            List<EventPayload> events = new ArrayList<>();
            events.add(new EventPayload.InvoiceCreated(
                command.customerName(),
                command.customerEmail(),
                command.issueDate(),
                command.dueDate()
            ));
            for (LineItem lineItem : command.lineItems()) {
                events.add(new EventPayload.LineItemAdded(
                    lineItem.getDescription(),
                    lineItem.getQuantity(),
                    lineItem.getPrice()
                ));
            }
            return CommandDecision.accept(events);
        }

        @Override
        public CommandDecision visitAddLineItem(CommandPayload.AddLineItem command) {
            if (invoice == null) {
                return doesNotExist();
            }
            if (!isPriced(command.quantity(), command.price())) {
                return unpriced();
            }
            return CommandDecision.accept(
                new EventPayload.LineItemAdded(command.description(), command.quantity(), command.price())
            );
        }

        @Override
        public CommandDecision visitRemoveLineItem(CommandPayload.RemoveLineItem command) {
            if (invoice == null) {
                return doesNotExist();
            }
            if (!invoice.hasLineItem(command.index())) {
                return CommandDecision.reject(new InvoiceError.LineItemDoesNotExist(command.index()));
            }
            return CommandDecision.accept(new EventPayload.LineItemRemoved(command.index()));
        }

        @Override
        public CommandDecision visitPayInvoice(CommandPayload.PayInvoice command) {
            if (invoice == null) {
                return doesNotExist();
            }
            return CommandDecision.accept(new EventPayload.PaymentReceived(invoice.total()));
        }

        @Override
        public CommandDecision visitDeleteInvoice(CommandPayload.DeleteInvoice command) {
            if (invoice == null) {
                return doesNotExist();
            }
            return CommandDecision.accept(new EventPayload.InvoiceDeleted());
        }

        private CommandDecision doesNotExist() {
            return CommandDecision.reject(new InvoiceError.InvalidState("Invoice does not exist"));
        }

        private static boolean isPriced(BigDecimal quantity, BigDecimal price) {
            return quantity != null && price != null;
        }

        private static CommandDecision unpriced() {
            return CommandDecision.reject(new InvoiceError.InvalidState("Line item needs a quantity and a price"));
        }
    }
}
