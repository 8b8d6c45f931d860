package com.flagship.invoices.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoices.invoice.event.EventPayload;
import com.flagship.invoices.invoice.event.InvoiceEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One entry of an invoice's history.
 */
@Value
public class EventResponse {

    @JsonProperty("version")
    int version;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("command_id")
    UUID commandId;

    @JsonProperty("event_type")
    String eventType;

    @JsonProperty("payload")
    EventPayload payload;

    public static EventResponse from(InvoiceEvent event) {
        return new EventResponse(
            event.getVersion(),
            event.getTimestamp(),
            event.getCommandId(),
            event.getPayload().eventType(),
            event.getPayload()
        );
    }
}
