package com.flagship.invoices.invoice.exception;

import com.flagship.invoices.invoice.InvoiceError;
import lombok.Getter;

import java.util.UUID;

/**
 * Carries a rejected command's error from the controller to {@link GlobalExceptionHandler}.
 * The rejection itself is already stored; this only shapes the HTTP response.
 */
@Getter
public class CommandRejectedException extends RuntimeException {

    private final UUID originId;
    private final UUID commandId;
    private final InvoiceError error;

    public CommandRejectedException(UUID originId, UUID commandId, InvoiceError error) {
        super("Command " + commandId + " rejected: " + error);
        this.originId = originId;
        this.commandId = commandId;
        this.error = error;
    }
}
