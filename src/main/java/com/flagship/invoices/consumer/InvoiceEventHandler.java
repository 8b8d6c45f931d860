package com.flagship.invoices.consumer;

import com.flagship.invoices.invoice.Invoice;
import com.flagship.invoices.invoice.InvoicePersistenceService;
import com.flagship.invoices.invoice.event.EventPayload;
import com.flagship.invoices.invoice.event.InvoiceEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Downstream reactions to invoice events.
 *
 * Called by {@link InvoiceEventConsumer} after the idempotency check, so every
 * reaction happens once per event. Notifications are simulated (logged).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoiceEventHandler {

    private final InvoicePersistenceService persistenceService;

    /**
     * @return a short description of what was done, for logging
     */
    public String handle(UUID originId, InvoiceEvent event) {
        return event.getPayload().accept(new Reaction(originId, event));
    }

    private final class Reaction implements EventPayload.Visitor<String> {

        private final UUID originId;
        private final InvoiceEvent event;

        private Reaction(UUID originId, InvoiceEvent event) {
            this.originId = originId;
            this.event = event;
        }

        @Override
        public String visitInvoiceCreated(EventPayload.InvoiceCreated created) {
            log.info("Would send invoice issued notification: invoice={}, to={}, due={}",
                    originId, created.customerEmail(), created.dueDate());
            return "invoice issued notification";
        }

        @Override
        public String visitLineItemAdded(EventPayload.LineItemAdded added) {
            log.debug("Line item added to invoice {} at version {}: {}", originId, event.getVersion(), added.description());
            return "no action";
        }

        @Override
        public String visitLineItemRemoved(EventPayload.LineItemRemoved removed) {
            log.debug("Line item {} removed from invoice {} at version {}", removed.index(), originId, event.getVersion());
            return "no action";
        }

        @Override
        public String visitPaymentReceived(EventPayload.PaymentReceived payment) {
            log.info("Would send payment receipt: invoice={}, to={}, amount={}",
                    originId, recipient(), payment.total());
            return "payment receipt";
        }

        @Override
        public String visitInvoiceDeleted(EventPayload.InvoiceDeleted deleted) {
            log.info("Would send invoice voided notification: invoice={}, to={}", originId, recipient());
            return "invoice voided notification";
        }

        private String recipient() {
            return persistenceService.load(originId).aggregate()
                    .map(Invoice::getCustomerEmail)
                    .orElse("unknown");
        }
    }
}
