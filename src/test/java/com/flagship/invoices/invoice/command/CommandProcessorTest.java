package com.flagship.invoices.invoice.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.invoices.config.JacksonConfig;
import com.flagship.invoices.invoice.Invoice;
import com.flagship.invoices.invoice.InvoiceError;
import com.flagship.invoices.invoice.InvoiceSnapshot;
import com.flagship.invoices.invoice.LineItem;
import com.flagship.invoices.invoice.SnapshotReducer;
import com.flagship.invoices.invoice.event.EventPayload;
import com.flagship.invoices.invoice.event.InvoiceEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Command processing against in-memory snapshots.
 *
 * These tests verify that:
 * - Versions advance by exactly one per event
 * - A command produces all of its events or none
 * - Stale expected versions are rejected without side effects
 * - Replaying the emitted events reproduces the returned snapshot
 */
class CommandProcessorTest {

    private final SnapshotReducer reducer = new SnapshotReducer();
    private final CommandProcessor processor = new CommandProcessor(new CommandDispatcher(), reducer);

    private final UUID originId = UUID.randomUUID();
    private final Instant now = Instant.parse("2024-03-15T09:30:00Z");

    private final List<InvoiceEvent> history = new ArrayList<>();

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private InvoiceCommand command(Integer expectedVersion, CommandPayload payload) {
        return new InvoiceCommand(originId, UUID.randomUUID(), expectedVersion, payload);
    }

    private CommandPayload.CreateInvoice createWithItems(int count) {
        List<LineItem> items = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            items.add(new LineItem("Item " + i, BigDecimal.ONE, new BigDecimal("10.00")));
        }
        return new CommandPayload.CreateInvoice("Acme Corp", "billing@acme.test",
                LocalDate.of(2024, 3, 15), LocalDate.of(2024, 4, 15), items);
    }

    /**
     * Processes the command and, on success, keeps the events as committed history.
     */
    private CommandResult.Success succeed(InvoiceCommand command, InvoiceSnapshot snapshot) {
        CommandResult result = processor.process(now, command, snapshot);
        CommandResult.Success success = assertInstanceOf(CommandResult.Success.class, result.getOutcome());
        history.addAll(success.events());
        return success;
    }

    private InvoiceError fail(InvoiceCommand command, InvoiceSnapshot snapshot) {
        CommandResult result = processor.process(now, command, snapshot);
        return assertInstanceOf(CommandResult.Failure.class, result.getOutcome()).cause();
    }

    @Nested
    @DisplayName("Invoice lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Create with two line items: version 0 -> 3, events numbered 1..3")
        void createWithLineItems() {
            printTestHeader("Create with two line items");

            CommandResult.Success success = succeed(command(0, createWithItems(2)), InvoiceSnapshot.empty());

            assertEquals(0, success.oldSnapshot().getVersion());
            assertEquals(3, success.newSnapshot().getVersion());
            assertEquals(List.of(1, 2, 3), success.events().stream().map(InvoiceEvent::getVersion).toList());
            assertEquals(0, new BigDecimal("20.00").compareTo(success.newSnapshot().getInvoice().total()));

            printOutput("Events", success.events().size());
            printSuccess("Create produced InvoiceCreated plus one LineItemAdded per item");
        }

        @Test
        @DisplayName("Add, remove and pay advance the version one step each")
        void followUpCommands() {
            InvoiceSnapshot snapshot = succeed(command(0, createWithItems(1)), InvoiceSnapshot.empty()).newSnapshot();

            snapshot = succeed(command(2, new CommandPayload.AddLineItem("Extra", new BigDecimal("2"), new BigDecimal("5.00"))),
                    snapshot).newSnapshot();
            assertEquals(3, snapshot.getVersion());

            snapshot = succeed(command(3, new CommandPayload.RemoveLineItem(0)), snapshot).newSnapshot();
            assertEquals(4, snapshot.getVersion());
            assertEquals("Extra", snapshot.getInvoice().getLineItems().get(0).getDescription());

            CommandResult.Success paid = succeed(command(4, new CommandPayload.PayInvoice()), snapshot);
            assertEquals(5, paid.newSnapshot().getVersion());
            assertTrue(paid.newSnapshot().getInvoice().isPaid());
            EventPayload.PaymentReceived payment = (EventPayload.PaymentReceived) paid.events().get(0).getPayload();
            assertEquals(0, new BigDecimal("10.00").compareTo(payment.total()));
        }

        @Test
        @DisplayName("Create with one 2 x 10.0 item: version 2, total 20.0")
        void createSingleItem() {
            CommandPayload.CreateInvoice create = new CommandPayload.CreateInvoice("Acme Corp", "billing@acme.test",
                    LocalDate.of(2024, 3, 15), LocalDate.of(2024, 4, 15),
                    List.of(new LineItem("Consulting", new BigDecimal("2"), new BigDecimal("10.0"))));

            CommandResult.Success success = succeed(command(0, create), InvoiceSnapshot.empty());

            assertEquals(2, success.newSnapshot().getVersion());
            assertInstanceOf(EventPayload.InvoiceCreated.class, success.events().get(0).getPayload());
            assertInstanceOf(EventPayload.LineItemAdded.class, success.events().get(1).getPayload());
            assertEquals(0, new BigDecimal("20.0").compareTo(success.newSnapshot().getInvoice().total()));
        }

        @Test
        @DisplayName("Paying records the current total and leaves it unchanged")
        void paymentKeepsTotal() {
            InvoiceSnapshot snapshot = succeed(command(0, createWithItems(2)), InvoiceSnapshot.empty()).newSnapshot();
            BigDecimal totalBefore = snapshot.getInvoice().total();

            CommandResult.Success paid = succeed(command(3, new CommandPayload.PayInvoice()), snapshot);

            Invoice invoice = paid.newSnapshot().getInvoice();
            assertTrue(invoice.isPaid());
            assertEquals(0, totalBefore.compareTo(invoice.total()));
            assertEquals(snapshot.getInvoice().getLineItems(), invoice.getLineItems());
            EventPayload.PaymentReceived payment = (EventPayload.PaymentReceived) paid.events().get(0).getPayload();
            assertEquals(0, totalBefore.compareTo(payment.total()));
        }

        @Test
        @DisplayName("Absent expected version skips the version check")
        void absentExpectedVersion() {
            InvoiceSnapshot snapshot = succeed(command(null, createWithItems(0)), InvoiceSnapshot.empty()).newSnapshot();

            CommandResult.Success success = succeed(command(null, new CommandPayload.DeleteInvoice()), snapshot);

            assertEquals(2, success.newSnapshot().getVersion());
            assertTrue(success.newSnapshot().getInvoice().isDeleted());
        }
    }

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @Test
        @DisplayName("Stale expected version is rejected with both versions")
        void staleVersion() {
            printTestHeader("Stale expected version");
            InvoiceSnapshot snapshot = succeed(command(0, createWithItems(2)), InvoiceSnapshot.empty()).newSnapshot();

            InvoiceError error = fail(command(1, new CommandPayload.PayInvoice()), snapshot);

            assertEquals(new InvoiceError.VersionConflict(1, 3), error);
            printOutput("Error", error);
            printSuccess("Stale command rejected, nothing emitted");
        }

        @Test
        @DisplayName("Version is checked before the payload")
        void versionCheckedFirst() {
            InvoiceError error = fail(command(5, new CommandPayload.PayInvoice()), InvoiceSnapshot.empty());

            assertEquals(new InvoiceError.VersionConflict(5, 0), error);
        }

        @Test
        @DisplayName("Removing a missing line item is rejected with its index")
        void missingLineItem() {
            InvoiceSnapshot snapshot = succeed(command(0, createWithItems(1)), InvoiceSnapshot.empty()).newSnapshot();

            InvoiceError error = fail(command(2, new CommandPayload.RemoveLineItem(1)), snapshot);

            assertEquals(new InvoiceError.LineItemDoesNotExist(1), error);
        }

        @Test
        @DisplayName("Creating twice is rejected as InvalidState")
        void createTwice() {
            InvoiceSnapshot snapshot = succeed(command(0, createWithItems(0)), InvoiceSnapshot.empty()).newSnapshot();

            InvoiceError error = fail(command(1, createWithItems(0)), snapshot);

            assertInstanceOf(InvoiceError.InvalidState.class, error);
        }

        @Test
        @DisplayName("AddLineItem without a quantity is rejected and the invoice stays payable")
        void addLineItemWithoutQuantity() throws Exception {
            printTestHeader("AddLineItem without a quantity");
            ObjectMapper objectMapper = new JacksonConfig().objectMapper();
            InvoiceSnapshot snapshot = succeed(command(0, createWithItems(1)), InvoiceSnapshot.empty()).newSnapshot();
            CommandPayload payload = objectMapper.readValue(
                    "{\"type\":\"AddLineItem\",\"description\":\"x\",\"price\":1}", CommandPayload.class);

            InvoiceError error = fail(command(2, payload), snapshot);

            assertInstanceOf(InvoiceError.InvalidState.class, error);
            CommandResult.Success paid = succeed(command(2, new CommandPayload.PayInvoice()), snapshot);
            assertEquals(3, paid.newSnapshot().getVersion());
            printOutput("Error", error);
            printSuccess("Incomplete line item rejected, nothing reached the history");
        }

        @Test
        @DisplayName("CreateInvoice with an unpriced line item emits nothing")
        void createWithUnpricedLineItem() {
            CommandPayload.CreateInvoice create = new CommandPayload.CreateInvoice("Acme Corp", "billing@acme.test",
                    LocalDate.of(2024, 3, 15), LocalDate.of(2024, 4, 15),
                    List.of(new LineItem("Priced", BigDecimal.ONE, BigDecimal.TEN),
                            new LineItem("Unpriced", BigDecimal.ONE, null)));

            InvoiceError error = fail(command(0, create), InvoiceSnapshot.empty());

            assertInstanceOf(InvoiceError.InvalidState.class, error);
            assertTrue(history.isEmpty());
        }

        @Test
        @DisplayName("Failure carries the command's ids and leaves the snapshot untouched")
        void failureCarriesIds() {
            InvoiceCommand command = command(null, new CommandPayload.PayInvoice());

            CommandResult result = processor.process(now, command, InvoiceSnapshot.empty());

            assertFalse(result.succeeded());
            assertEquals(originId, result.getOriginId());
            assertEquals(command.getCommandId(), result.getCommandId());
        }
    }

    @Nested
    @DisplayName("Event properties")
    class EventProperties {

        @Test
        @DisplayName("All events of one command share its id and timestamp")
        void eventsShareCommandIdAndTimestamp() {
            InvoiceCommand command = command(0, createWithItems(3));

            CommandResult.Success success = succeed(command, InvoiceSnapshot.empty());

            assertEquals(4, success.events().size());
            for (InvoiceEvent event : success.events()) {
                assertEquals(command.getCommandId(), event.getCommandId());
                assertEquals(now, event.getTimestamp());
            }
        }

        @Test
        @DisplayName("New version equals old version plus the number of events")
        void versionConservation() {
            InvoiceSnapshot snapshot = succeed(command(0, createWithItems(2)), InvoiceSnapshot.empty()).newSnapshot();

            CommandResult.Success success = succeed(command(3, new CommandPayload.AddLineItem("x", BigDecimal.ONE, BigDecimal.ONE)), snapshot);

            assertEquals(success.oldSnapshot().getVersion() + success.events().size(),
                    success.newSnapshot().getVersion());
            assertSame(snapshot, success.oldSnapshot());
        }

        @Test
        @DisplayName("Adding a line item and removing it again restores items and total")
        void addThenRemoveRestoresTotal() {
            InvoiceSnapshot before = succeed(command(0, createWithItems(2)), InvoiceSnapshot.empty()).newSnapshot();

            InvoiceSnapshot added = succeed(command(3,
                    new CommandPayload.AddLineItem("Temporary", new BigDecimal("3"), new BigDecimal("7.25"))), before).newSnapshot();
            int newIndex = added.getInvoice().getLineItems().size() - 1;
            InvoiceSnapshot removed = succeed(command(4, new CommandPayload.RemoveLineItem(newIndex)), added).newSnapshot();

            assertEquals(before.getInvoice().getLineItems(), removed.getInvoice().getLineItems());
            assertEquals(0, before.getInvoice().total().compareTo(removed.getInvoice().total()));
            assertEquals(5, removed.getVersion());
        }

        @Test
        @DisplayName("Replaying the full history reproduces the latest snapshot")
        void replayMatchesLatestSnapshot() {
            printTestHeader("Replay equivalence");
            InvoiceSnapshot snapshot = succeed(command(0, createWithItems(2)), InvoiceSnapshot.empty()).newSnapshot();
            snapshot = succeed(command(3, new CommandPayload.RemoveLineItem(0)), snapshot).newSnapshot();
            snapshot = succeed(command(4, new CommandPayload.PayInvoice()), snapshot).newSnapshot();
            snapshot = succeed(command(5, new CommandPayload.DeleteInvoice()), snapshot).newSnapshot();

            InvoiceSnapshot replayed = reducer.replay(history);

            assertEquals(snapshot, replayed);
            printOutput("Replayed version", replayed.getVersion());
            printSuccess("Replay matches the incrementally built snapshot");
        }

        @Test
        @DisplayName("Processing is deterministic")
        void deterministic() {
            InvoiceCommand command = command(0, createWithItems(2));

            CommandResult first = processor.process(now, command, InvoiceSnapshot.empty());
            CommandResult second = processor.process(now, command, InvoiceSnapshot.empty());

            assertEquals(first, second);
        }
    }
}
