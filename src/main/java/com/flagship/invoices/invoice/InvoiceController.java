package com.flagship.invoices.invoice;

import com.flagship.invoices.eventlog.EventLogService;
import com.flagship.invoices.invoice.command.CommandPayload;
import com.flagship.invoices.invoice.command.CommandResult;
import com.flagship.invoices.invoice.command.InvoiceCommand;
import com.flagship.invoices.invoice.dto.CommandResultResponse;
import com.flagship.invoices.invoice.dto.CreateInvoiceRequest;
import com.flagship.invoices.invoice.dto.EventResponse;
import com.flagship.invoices.invoice.dto.InvoiceResponse;
import com.flagship.invoices.invoice.dto.LineItemRequest;
import com.flagship.invoices.invoice.dto.ReplayResponse;
import com.flagship.invoices.invoice.exception.CommandRejectedException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * REST controller issuing invoice commands.
 *
 * - Idempotency-Key (required, UUID) is the command id: repeating a request returns
 *   the stored result and produces no new events
 * - Expected-Version (optional) is the optimistic lock; without it the command applies
 *   to whatever version is current
 * - A rejected command answers with the error's status (see ErrorView)
 */
@RestController
@RequestMapping("/api/invoices")
@RequiredArgsConstructor
@Slf4j
public class InvoiceController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    static final String EXPECTED_VERSION_HEADER = "Expected-Version";

    private final InvoiceCommandService commandService;
    private final EventLogService eventLog;

    /**
     * Creates an invoice under a server-assigned origin id.
     */
    @PostMapping
    public ResponseEntity<CommandResultResponse> createInvoice(
            @Valid @RequestBody CreateInvoiceRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) UUID commandId,
            @RequestHeader(value = EXPECTED_VERSION_HEADER, required = false) Integer expectedVersion) {

        log.info("Received invoice creation request: commandId={}, lineItems={}",
                commandId, request.getLineItems() == null ? 0 : request.getLineItems().size());

        CommandResult result = execute(UUID.randomUUID(), commandId, expectedVersion, request.toCommandPayload());
        return ResponseEntity.created(URI.create("/api/invoices/" + result.getOriginId()))
                .body(CommandResultResponse.from(result));
    }

    @PostMapping("/{id}/line-items")
    public ResponseEntity<CommandResultResponse> addLineItem(
            @PathVariable("id") UUID originId,
            @Valid @RequestBody LineItemRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) UUID commandId,
            @RequestHeader(value = EXPECTED_VERSION_HEADER, required = false) Integer expectedVersion) {

        CommandResult result = execute(originId, commandId, expectedVersion, request.toCommandPayload());
        return ResponseEntity.ok(CommandResultResponse.from(result));
    }

    @DeleteMapping("/{id}/line-items/{index}")
    public ResponseEntity<CommandResultResponse> removeLineItem(
            @PathVariable("id") UUID originId,
            @PathVariable("index") int index,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) UUID commandId,
            @RequestHeader(value = EXPECTED_VERSION_HEADER, required = false) Integer expectedVersion) {

        CommandResult result = execute(originId, commandId, expectedVersion, new CommandPayload.RemoveLineItem(index));
        return ResponseEntity.ok(CommandResultResponse.from(result));
    }

    @PostMapping("/{id}/payments")
    public ResponseEntity<CommandResultResponse> payInvoice(
            @PathVariable("id") UUID originId,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) UUID commandId,
            @RequestHeader(value = EXPECTED_VERSION_HEADER, required = false) Integer expectedVersion) {

        CommandResult result = execute(originId, commandId, expectedVersion, new CommandPayload.PayInvoice());
        return ResponseEntity.ok(CommandResultResponse.from(result));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<CommandResultResponse> deleteInvoice(
            @PathVariable("id") UUID originId,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) UUID commandId,
            @RequestHeader(value = EXPECTED_VERSION_HEADER, required = false) Integer expectedVersion) {

        CommandResult result = execute(originId, commandId, expectedVersion, new CommandPayload.DeleteInvoice());
        return ResponseEntity.ok(CommandResultResponse.from(result));
    }

    @GetMapping("/{id}")
    public ResponseEntity<InvoiceResponse> getInvoice(@PathVariable("id") UUID originId) {
        InvoiceSnapshot snapshot = commandService.getSnapshot(originId);
        if (!snapshot.exists()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(InvoiceResponse.from(originId, snapshot));
    }

    @GetMapping("/{id}/events")
    public ResponseEntity<List<EventResponse>> getEvents(@PathVariable("id") UUID originId) {
        List<EventResponse> events = eventLog.history(originId).stream()
                .map(EventResponse::from)
                .toList();
        return ResponseEntity.ok(events);
    }

    /**
     * Rebuilds the invoice from its events and reports whether it equals the stored snapshot.
     */
    @GetMapping("/{id}/replay")
    public ResponseEntity<ReplayResponse> replay(@PathVariable("id") UUID originId) {
        InvoiceSnapshot stored = commandService.getSnapshot(originId);
        InvoiceSnapshot replayed = eventLog.replay(originId);

        ReplayResponse response = new ReplayResponse(
                originId,
                stored.getVersion(),
                replayed.getVersion(),
                replayed.equals(stored),
                replayed.exists() ? InvoiceResponse.from(originId, replayed) : null
        );
        return ResponseEntity.ok(response);
    }

    @GetMapping("/commands/{commandId}")
    public ResponseEntity<CommandResultResponse> getCommandResult(@PathVariable("commandId") UUID commandId) {
        return commandService.getResult(commandId)
                .map(result -> ResponseEntity.ok(CommandResultResponse.from(result)))
                .orElse(ResponseEntity.notFound().build());
    }

    private CommandResult execute(UUID originId, UUID commandId, Integer expectedVersion, CommandPayload payload) {
        CommandResult result = commandService.execute(new InvoiceCommand(originId, commandId, expectedVersion, payload));

        Optional<InvoiceError> rejection = result.getOutcome().fold(
                success -> Optional.empty(),
                failure -> Optional.of(failure.cause())
        );
        if (rejection.isPresent()) {
            throw new CommandRejectedException(result.getOriginId(), result.getCommandId(), rejection.get());
        }
        return result;
    }
}
