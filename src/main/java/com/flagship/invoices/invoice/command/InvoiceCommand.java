package com.flagship.invoices.invoice.command;

import lombok.Value;

import java.util.UUID;

/**
 * An intent to change one invoice.
 *
 * - originId: the invoice (aggregate) identity, also the partition key
 * - commandId: idempotency and correlation key, stamped on every resulting event
 * - expectedVersion: optimistic lock; null skips the check
 */
@Value
public class InvoiceCommand {
    UUID originId;
    UUID commandId;
    Integer expectedVersion;
    CommandPayload payload;
}
