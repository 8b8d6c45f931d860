package com.flagship.invoices.invoice.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Wire form of an event on the events topic: the event plus the invoice it belongs to.
 * The record key carries the origin id too, the body repeats it so consumers need
 * nothing but the value.
 */
@Value
public class InvoiceEventEnvelope {
    UUID originId;
    int version;
    Instant timestamp;
    UUID commandId;
    EventPayload payload;

    public static InvoiceEventEnvelope of(UUID originId, InvoiceEvent event) {
        return new InvoiceEventEnvelope(
            originId,
            event.getVersion(),
            event.getTimestamp(),
            event.getCommandId(),
            event.getPayload()
        );
    }
}
