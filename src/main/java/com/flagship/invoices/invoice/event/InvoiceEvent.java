package com.flagship.invoices.invoice.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An immutable, versioned fact about one invoice.
 *
 * The version is the snapshot version right after this event is applied, so the
 * events of one origin id are numbered 1, 2, 3, ... without gaps. Every event
 * produced by one command carries that command's id and timestamp, which lets
 * consumers correlate them and recognise re-deliveries.
 */
@Value
public class InvoiceEvent {
    int version;
    Instant timestamp;
    UUID commandId;
    EventPayload payload;
}
