package com.flagship.invoices.invoice;

import com.flagship.invoices.invoice.event.EventPayload;
import com.flagship.invoices.invoice.event.InvoiceEvent;
import org.springframework.stereotype.Component;

/**
 * Folds events into snapshots.
 *
 * State machine:
 * - NonExistent -> Active: InvoiceCreated only
 * - Active -> Active: LineItemAdded, LineItemRemoved, PaymentReceived (paid), InvoiceDeleted (deleted)
 *
 * Pure and deterministic: replaying the same events from the empty snapshot always
 * gives the same snapshot. Anything outside the state machine (a version gap, an
 * event for an invoice that was never created, an index that does not exist) means
 * the log is corrupt and raises {@link CorruptEventLogException}.
 */
@Component
public class SnapshotReducer {

    /**
     * Applies one event.
     *
     * @return New snapshot at the event's version
     * @throws CorruptEventLogException if the event does not follow the snapshot
     */
    public InvoiceSnapshot handle(InvoiceSnapshot snapshot, InvoiceEvent event) {
        int expectedVersion = snapshot.getVersion() + 1;
        if (event.getVersion() != expectedVersion) {
            throw new CorruptEventLogException(
                String.format("Event version %d does not follow snapshot version %d",
                    event.getVersion(), snapshot.getVersion())
            );
        }

        Invoice invoice = event.getPayload().accept(new Transition(snapshot.getInvoice(), event));
        return new InvoiceSnapshot(event.getVersion(), invoice);
    }

    /**
     * Rebuilds a snapshot from a full history, starting at version 0.
     */
    public InvoiceSnapshot replay(Iterable<InvoiceEvent> events) {
        InvoiceSnapshot snapshot = InvoiceSnapshot.empty();
        for (InvoiceEvent event : events) {
            snapshot = handle(snapshot, event);
        }
        return snapshot;
    }

    private static final class Transition implements EventPayload.Visitor<Invoice> {

        private final Invoice current;
        private final InvoiceEvent event;

        private Transition(Invoice current, InvoiceEvent event) {
            this.current = current;
            this.event = event;
        }

        @Override
        public Invoice visitInvoiceCreated(EventPayload.InvoiceCreated created) {
            if (current != null) {
                throw corrupt("invoice already exists");
            }
            return Invoice.create(
                created.customerName(),
                created.customerEmail(),
                created.issueDate(),
                created.dueDate()
            );
        }

        @Override
        public Invoice visitLineItemAdded(EventPayload.LineItemAdded added) {
            return existing().addLineItem(
                new LineItem(added.description(), added.quantity(), added.price())
            );
        }

        @Override
        public Invoice visitLineItemRemoved(EventPayload.LineItemRemoved removed) {
            try {
                return existing().removeLineItem(removed.index());
            } catch (IndexOutOfBoundsException e) {
                throw new CorruptEventLogException(
                    String.format("Cannot apply %s at version %d: %s",
                        event.getPayload().eventType(), event.getVersion(), e.getMessage()),
                    e
                );
            }
        }

        @Override
        public Invoice visitPaymentReceived(EventPayload.PaymentReceived payment) {
            return existing().markPaid();
        }

        @Override
        public Invoice visitInvoiceDeleted(EventPayload.InvoiceDeleted deleted) {
            return existing().markDeleted();
        }

        private Invoice existing() {
            if (current == null) {
                throw corrupt("invoice does not exist");
            }
            return current;
        }

        private CorruptEventLogException corrupt(String reason) {
            return new CorruptEventLogException(
                String.format("Cannot apply %s at version %d: %s",
                    event.getPayload().eventType(), event.getVersion(), reason)
            );
        }
    }
}
