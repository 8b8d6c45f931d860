package com.flagship.invoices.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoices.invoice.LineItem;
import com.flagship.invoices.invoice.command.CommandPayload;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request DTO for one line item, used standalone (add) and inside a create request.
 */
@Value
public class LineItemRequest {

    @NotBlank(message = "Description is required")
    @JsonProperty("description")
    String description;

    @NotNull(message = "Quantity is required")
    @DecimalMin(value = "0", message = "Quantity must not be negative")
    @JsonProperty("quantity")
    BigDecimal quantity;

    @NotNull(message = "Price is required")
    @DecimalMin(value = "0", message = "Price must not be negative")
    @JsonProperty("price")
    BigDecimal price;

    public LineItem toLineItem() {
        return new LineItem(description, quantity, price);
    }

    public CommandPayload.AddLineItem toCommandPayload() {
        return new CommandPayload.AddLineItem(description, quantity, price);
    }
}
