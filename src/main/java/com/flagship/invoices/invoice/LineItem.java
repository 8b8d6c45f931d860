package com.flagship.invoices.invoice;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A single billable line on an invoice.
 *
 * Quantity and price are always present; commands without them are rejected before
 * an item is created. They are expected to be non-negative, which the HTTP layer
 * validates and the domain does not.
 */
@Value
public class LineItem {
    String description;
    BigDecimal quantity;
    BigDecimal price;

    /**
     * quantity x price
     */
    public BigDecimal total() {
        return quantity.multiply(price);
    }
}
