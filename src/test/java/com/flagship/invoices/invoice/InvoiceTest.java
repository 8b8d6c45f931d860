package com.flagship.invoices.invoice;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class InvoiceTest {

    private static final LocalDate ISSUED = LocalDate.of(2024, 1, 1);
    private static final LocalDate DUE = LocalDate.of(2024, 1, 31);

    private Invoice newInvoice() {
        return Invoice.create("Acme Corp", "billing@acme.test", ISSUED, DUE);
    }

    private LineItem item(String description, String quantity, String price) {
        return new LineItem(description, new BigDecimal(quantity), new BigDecimal(price));
    }

    @Test
    @DisplayName("New invoice has no line items and a zero total")
    void createStartsEmpty() {
        Invoice invoice = newInvoice();

        assertTrue(invoice.getLineItems().isEmpty());
        assertEquals(0, invoice.total().compareTo(BigDecimal.ZERO));
        assertFalse(invoice.isPaid());
        assertFalse(invoice.isDeleted());
    }

    @Test
    @DisplayName("Total is the sum of quantity x price")
    void totalSumsLineItems() {
        Invoice invoice = newInvoice()
                .addLineItem(item("Widget", "2", "10.50"))
                .addLineItem(item("Gadget", "3", "0.25"));

        assertEquals(0, new BigDecimal("21.75").compareTo(invoice.total()));
    }

    @Test
    @DisplayName("Changes return a new invoice and leave the original untouched")
    void changesDoNotMutate() {
        Invoice original = newInvoice();
        Invoice withItem = original.addLineItem(item("Widget", "1", "5"));
        Invoice paid = withItem.markPaid();

        assertTrue(original.getLineItems().isEmpty());
        assertEquals(1, withItem.getLineItems().size());
        assertFalse(withItem.isPaid());
        assertTrue(paid.isPaid());
        assertThrows(UnsupportedOperationException.class,
                () -> withItem.getLineItems().add(item("Sneaky", "1", "1")));
    }

    @Test
    @DisplayName("Removing a line item shifts later items down")
    void removeShiftsLaterItems() {
        Invoice invoice = newInvoice()
                .addLineItem(item("A", "1", "1"))
                .addLineItem(item("B", "1", "2"))
                .addLineItem(item("C", "1", "3"));

        Invoice removed = invoice.removeLineItem(1);

        assertEquals(2, removed.getLineItems().size());
        assertEquals("A", removed.getLineItems().get(0).getDescription());
        assertEquals("C", removed.getLineItems().get(1).getDescription());
    }

    @Test
    @DisplayName("Removing a missing index throws")
    void removeMissingIndexThrows() {
        Invoice invoice = newInvoice().addLineItem(item("A", "1", "1"));

        assertThrows(IndexOutOfBoundsException.class, () -> invoice.removeLineItem(1));
        assertThrows(IndexOutOfBoundsException.class, () -> invoice.removeLineItem(-1));
        assertFalse(invoice.hasLineItem(1));
        assertTrue(invoice.hasLineItem(0));
    }

    @Test
    @DisplayName("Paid and deleted are independent flags")
    void paidAndDeletedAreIndependent() {
        Invoice both = newInvoice().markDeleted().markPaid();

        assertTrue(both.isPaid());
        assertTrue(both.isDeleted());
    }
}
