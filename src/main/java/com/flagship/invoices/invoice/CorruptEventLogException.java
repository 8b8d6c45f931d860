package com.flagship.invoices.invoice;

/**
 * Raised when an event cannot be applied to the snapshot it is folded into.
 *
 * Events are validated when they are produced, so this only happens when
 * committed state has been corrupted upstream. Not a business error: it is never
 * turned into a command failure and the hosting process treats it as fatal.
 */
public class CorruptEventLogException extends IllegalStateException {

    public CorruptEventLogException(String message) {
        super(message);
    }

    public CorruptEventLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
