package com.flagship.invoices.invoice;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Invoice aggregate, rebuilt from its event history.
 *
 * Key principles:
 * - Never mutated: every change returns a new Invoice
 * - The total is derived from the line items, never stored
 * - Paid and deleted are independent flags, an invoice can be both
 *
 * Instances are only produced by {@link SnapshotReducer}; command handlers read them.
 */
@Value
public class Invoice {
    String customerName;
    String customerEmail;
    LocalDate issueDate;
    LocalDate dueDate;
    List<LineItem> lineItems;
    boolean paid;
    boolean deleted;

    /**
     * Creates an invoice with no line items, neither paid nor deleted.
     */
    public static Invoice create(String customerName, String customerEmail,
                                 LocalDate issueDate, LocalDate dueDate) {
        return new Invoice(
            customerName,
            customerEmail,
            issueDate,
            dueDate,
            List.of(),
            false,
            false
        );
    }

    /**
     * @return New Invoice with the line item appended at the end
     */
    public Invoice addLineItem(LineItem lineItem) {
        List<LineItem> items = new ArrayList<>(this.lineItems);
        items.add(lineItem);
        return withLineItems(items);
    }

    /**
     * Removes the line item at the given position; later items shift down by one.
     *
     * @return New Invoice without the line item
     * @throws IndexOutOfBoundsException if there is no line item at that position
     */
    public Invoice removeLineItem(int index) {
        if (!hasLineItem(index)) {
            throw new IndexOutOfBoundsException(
                String.format("No line item at index %d, invoice has %d", index, lineItems.size())
            );
        }
        List<LineItem> items = new ArrayList<>(this.lineItems);
        items.remove(index);
        return withLineItems(items);
    }

    public Invoice markPaid() {
        return new Invoice(
            this.customerName,
            this.customerEmail,
            this.issueDate,
            this.dueDate,
            this.lineItems,
            true,
            this.deleted
        );
    }

    public Invoice markDeleted() {
        return new Invoice(
            this.customerName,
            this.customerEmail,
            this.issueDate,
            this.dueDate,
            this.lineItems,
            this.paid,
            true
        );
    }

    /**
     * Checks if a line item exists at the given position.
     */
    public boolean hasLineItem(int index) {
        return index >= 0 && index < lineItems.size();
    }

    /**
     * Sum of quantity x price over all line items.
     */
    public BigDecimal total() {
        return lineItems.stream()
            .map(LineItem::total)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private Invoice withLineItems(List<LineItem> items) {
        return new Invoice(
            this.customerName,
            this.customerEmail,
            this.issueDate,
            this.dueDate,
            List.copyOf(items),
            this.paid,
            this.deleted
        );
    }
}
