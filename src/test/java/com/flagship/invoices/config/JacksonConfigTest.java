package com.flagship.invoices.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.invoices.invoice.Invoice;
import com.flagship.invoices.invoice.InvoiceError;
import com.flagship.invoices.invoice.InvoiceSnapshot;
import com.flagship.invoices.invoice.LineItem;
import com.flagship.invoices.invoice.command.CommandPayload;
import com.flagship.invoices.invoice.command.CommandResult;
import com.flagship.invoices.invoice.command.InvoiceCommand;
import com.flagship.invoices.invoice.event.EventPayload;
import com.flagship.invoices.invoice.event.InvoiceEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wire shape of the messages and stored documents.
 */
class JacksonConfigTest {

    private final ObjectMapper mapper = new JacksonConfig().objectMapper();

    @Test
    @DisplayName("Event payloads carry their type and ISO dates")
    void eventPayloadShape() throws Exception {
        EventPayload payload = new EventPayload.InvoiceCreated("Acme Corp", "billing@acme.test",
                LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

        JsonNode json = mapper.readTree(mapper.writerFor(EventPayload.class).writeValueAsString(payload));

        assertEquals("InvoiceCreated", json.get("type").asText());
        assertEquals("2024-01-31", json.get("dueDate").asText());
        assertFalse(json.has("eventType"));
    }

    @Test
    @DisplayName("Payload-less variants serialize as just their type")
    void emptyVariants() throws Exception {
        String json = mapper.writerFor(EventPayload.class).writeValueAsString(new EventPayload.InvoiceDeleted());

        assertEquals("{\"type\":\"InvoiceDeleted\"}", json);
        assertEquals(new EventPayload.InvoiceDeleted(), mapper.readValue(json, EventPayload.class));
    }

    @Test
    @DisplayName("Amounts are written plain and read back exactly")
    void amountsStayExact() throws Exception {
        EventPayload payment = new EventPayload.PaymentReceived(new BigDecimal("1E+3"));

        String json = mapper.writerFor(EventPayload.class).writeValueAsString(payment);

        assertTrue(json.contains("1000"), json);
        EventPayload back = mapper.readValue("{\"type\":\"PaymentReceived\",\"total\":0.1}", EventPayload.class);
        assertEquals(new BigDecimal("0.1"), ((EventPayload.PaymentReceived) back).total());
    }

    @Test
    @DisplayName("Errors carry their type")
    void errorShape() throws Exception {
        JsonNode json = mapper.readTree(mapper.writerFor(InvoiceError.class)
                .writeValueAsString(new InvoiceError.VersionConflict(2, 5)));

        assertEquals("VersionConflict", json.get("type").asText());
        assertEquals(2, json.get("expectedVersion").asInt());
        assertEquals(5, json.get("actualVersion").asInt());
    }

    @Test
    @DisplayName("Command results carry a status and read back equal")
    void commandResultRoundTrip() throws Exception {
        UUID originId = UUID.randomUUID();
        UUID commandId = UUID.randomUUID();
        Instant now = Instant.parse("2024-01-01T10:00:00Z");
        Invoice invoice = Invoice.create("Acme Corp", "billing@acme.test", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));
        InvoiceCommand command = new InvoiceCommand(originId, commandId, 0, new CommandPayload.PayInvoice());

        CommandResult success = CommandResult.success(command,
                List.of(new InvoiceEvent(1, now, commandId, new EventPayload.InvoiceCreated(
                        "Acme Corp", "billing@acme.test", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31)))),
                InvoiceSnapshot.empty(), new InvoiceSnapshot(1, invoice));
        CommandResult failure = CommandResult.failure(command, new InvoiceError.LineItemDoesNotExist(3));

        String successJson = mapper.writeValueAsString(success);
        String failureJson = mapper.writeValueAsString(failure);

        assertEquals("SUCCESS", mapper.readTree(successJson).get("outcome").get("status").asText());
        assertEquals("FAILURE", mapper.readTree(failureJson).get("outcome").get("status").asText());
        assertFalse(mapper.readTree(successJson).has("succeeded"));
        assertEquals(success, mapper.readValue(successJson, CommandResult.class));
        assertEquals(failure, mapper.readValue(failureJson, CommandResult.class));
    }

    @Test
    @DisplayName("Commands read from their wire form")
    void commandFromJson() throws Exception {
        UUID originId = UUID.randomUUID();
        UUID commandId = UUID.randomUUID();
        String json = """
            {"originId":"%s","commandId":"%s","expectedVersion":null,
             "payload":{"type":"CreateInvoice","customerName":"Acme Corp","customerEmail":"billing@acme.test",
                        "issueDate":"2024-01-01","dueDate":"2024-01-31",
                        "lineItems":[{"description":"Widget","quantity":2,"price":9.99}]}}
            """.formatted(originId, commandId);

        InvoiceCommand command = mapper.readValue(json, InvoiceCommand.class);

        assertEquals(originId, command.getOriginId());
        assertNull(command.getExpectedVersion());
        CommandPayload.CreateInvoice create = assertInstanceOf(CommandPayload.CreateInvoice.class, command.getPayload());
        assertEquals(List.of(new LineItem("Widget", new BigDecimal("2"), new BigDecimal("9.99"))), create.lineItems());
    }

    @Test
    @DisplayName("Snapshots read back equal, including the empty one")
    void snapshotRoundTrip() throws Exception {
        Invoice invoice = Invoice.create("Acme Corp", "billing@acme.test", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31))
                .addLineItem(new LineItem("Widget", new BigDecimal("2"), new BigDecimal("9.99")))
                .markPaid();
        InvoiceSnapshot snapshot = new InvoiceSnapshot(3, invoice);

        assertEquals(snapshot, mapper.readValue(mapper.writeValueAsString(snapshot), InvoiceSnapshot.class));
        assertEquals(InvoiceSnapshot.empty(),
                mapper.readValue(mapper.writeValueAsString(InvoiceSnapshot.empty()), InvoiceSnapshot.class));
    }
}
