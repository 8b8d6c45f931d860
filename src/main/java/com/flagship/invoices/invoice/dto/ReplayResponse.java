package com.flagship.invoices.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.UUID;

/**
 * Snapshot rebuilt from the event log, compared with the stored one.
 */
@Value
public class ReplayResponse {

    @JsonProperty("origin_id")
    UUID originId;

    @JsonProperty("stored_version")
    int storedVersion;

    @JsonProperty("replayed_version")
    int replayedVersion;

    @JsonProperty("matches_stored")
    boolean matchesStored;

    @JsonProperty("invoice")
    InvoiceResponse invoice;    // null if the log holds nothing for this origin id
}
