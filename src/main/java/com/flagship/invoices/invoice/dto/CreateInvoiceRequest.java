package com.flagship.invoices.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoices.invoice.command.CommandPayload;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Request DTO for creating an invoice, optionally with its first line items.
 */
@Value
public class CreateInvoiceRequest {

    @NotBlank(message = "Customer name is required")
    @JsonProperty("customer_name")
    String customerName;

    @NotBlank(message = "Customer email is required")
    @Email(message = "Customer email must be a valid address")
    @JsonProperty("customer_email")
    String customerEmail;

    @NotNull(message = "Issue date is required")
    @JsonProperty("issue_date")
    LocalDate issueDate;

    @NotNull(message = "Due date is required")
    @JsonProperty("due_date")
    LocalDate dueDate;

    @Valid
    @JsonProperty("line_items")
    List<LineItemRequest> lineItems;

    public CommandPayload.CreateInvoice toCommandPayload() {
        return new CommandPayload.CreateInvoice(
            customerName,
            customerEmail,
            issueDate,
            dueDate,
            lineItems == null
                ? List.of()
                : lineItems.stream().map(LineItemRequest::toLineItem).toList()
        );
    }
}
