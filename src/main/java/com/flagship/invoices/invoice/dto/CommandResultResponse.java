package com.flagship.invoices.invoice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoices.invoice.InvoiceError;
import com.flagship.invoices.invoice.command.CommandResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Response DTO for an executed command: the events it produced and the invoice after
 * it, or the error that rejected it.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CommandResultResponse {

    @JsonProperty("origin_id")
    UUID originId;

    @JsonProperty("command_id")
    UUID commandId;

    @JsonProperty("status")
    String status;

    @JsonProperty("events")
    List<EventResponse> events;

    @JsonProperty("invoice")
    InvoiceResponse invoice;

    @JsonProperty("error")
    InvoiceError error;

    public static CommandResultResponse from(CommandResult result) {
        var builder = CommandResultResponse.builder()
            .originId(result.getOriginId())
            .commandId(result.getCommandId());

        return result.getOutcome().fold(
            success -> builder
                .status("SUCCESS")
                .events(success.events().stream().map(EventResponse::from).toList())
                .invoice(InvoiceResponse.from(result.getOriginId(), success.newSnapshot()))
                .build(),
            failure -> builder
                .status("FAILURE")
                .error(failure.cause())
                .build()
        );
    }
}
