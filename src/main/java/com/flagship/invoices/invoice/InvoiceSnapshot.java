package com.flagship.invoices.invoice;

import lombok.Value;

import java.util.Optional;

/**
 * Versioned materialization of an invoice.
 *
 * Version 0 with no invoice is the snapshot of an origin id nothing was ever
 * written for. Each applied event raises the version by exactly one.
 */
@Value
public class InvoiceSnapshot {
    int version;
    Invoice invoice;    // null until InvoiceCreated has been applied

    private static final InvoiceSnapshot EMPTY = new InvoiceSnapshot(0, null);

    public static InvoiceSnapshot empty() {
        return EMPTY;
    }

    public Optional<Invoice> aggregate() {
        return Optional.ofNullable(invoice);
    }

    public boolean exists() {
        return invoice != null;
    }

    /**
     * Optimistic concurrency gate.
     *
     * An absent expected version skips the check.
     *
     * @param expectedVersion Version the command was built against, or null
     * @return VersionConflict if the expectation is stale, empty otherwise
     */
    public Optional<InvoiceError> validateVersion(Integer expectedVersion) {
        if (expectedVersion == null || expectedVersion == version) {
            return Optional.empty();
        }
        return Optional.of(new InvoiceError.VersionConflict(expectedVersion, version));
    }
}
