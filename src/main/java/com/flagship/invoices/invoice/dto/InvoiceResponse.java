package com.flagship.invoices.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoices.invoice.Invoice;
import com.flagship.invoices.invoice.InvoiceSnapshot;
import com.flagship.invoices.invoice.LineItem;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for an invoice snapshot. Totals are computed here, they are not stored.
 */
@Value
@Builder
public class InvoiceResponse {

    @JsonProperty("origin_id")
    UUID originId;

    @JsonProperty("version")
    int version;

    @JsonProperty("customer_name")
    String customerName;

    @JsonProperty("customer_email")
    String customerEmail;

    @JsonProperty("issue_date")
    LocalDate issueDate;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("line_items")
    List<LineItemView> lineItems;

    @JsonProperty("total")
    BigDecimal total;

    @JsonProperty("paid")
    boolean paid;

    @JsonProperty("deleted")
    boolean deleted;

    /**
     * @throws IllegalArgumentException if the snapshot holds no invoice
     */
    public static InvoiceResponse from(UUID originId, InvoiceSnapshot snapshot) {
        Invoice invoice = snapshot.aggregate()
            .orElseThrow(() -> new IllegalArgumentException("Invoice " + originId + " does not exist"));
        return InvoiceResponse.builder()
            .originId(originId)
            .version(snapshot.getVersion())
            .customerName(invoice.getCustomerName())
            .customerEmail(invoice.getCustomerEmail())
            .issueDate(invoice.getIssueDate())
            .dueDate(invoice.getDueDate())
            .lineItems(invoice.getLineItems().stream().map(LineItemView::from).toList())
            .total(invoice.total())
            .paid(invoice.isPaid())
            .deleted(invoice.isDeleted())
            .build();
    }

    @Value
    public static class LineItemView {
        @JsonProperty("description")
        String description;

        @JsonProperty("quantity")
        BigDecimal quantity;

        @JsonProperty("price")
        BigDecimal price;

        @JsonProperty("total")
        BigDecimal total;

        static LineItemView from(LineItem lineItem) {
            return new LineItemView(
                lineItem.getDescription(),
                lineItem.getQuantity(),
                lineItem.getPrice(),
                lineItem.total()
            );
        }
    }
}
