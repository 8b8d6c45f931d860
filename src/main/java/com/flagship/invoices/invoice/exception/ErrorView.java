package com.flagship.invoices.invoice.exception;

import com.flagship.invoices.invoice.InvoiceError;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.springframework.http.HttpStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP presentation of an {@link InvoiceError}: status, error code, message and details.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ErrorView {

    HttpStatus status;
    String code;
    String message;
    Map<String, Object> details;

    public static ErrorView of(InvoiceError error) {
        return error.accept(PRESENTER);
    }

    private static final InvoiceError.Visitor<ErrorView> PRESENTER = new InvoiceError.Visitor<>() {

        @Override
        public ErrorView visitVersionConflict(InvoiceError.VersionConflict error) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("expected_version", error.expectedVersion());
            details.put("actual_version", error.actualVersion());
            return new ErrorView(
                HttpStatus.CONFLICT,
                "Version Conflict",
                String.format("Expected version %d but invoice is at version %d",
                    error.expectedVersion(), error.actualVersion()),
                details
            );
        }

        @Override
        public ErrorView visitLineItemDoesNotExist(InvoiceError.LineItemDoesNotExist error) {
            return new ErrorView(
                HttpStatus.UNPROCESSABLE_ENTITY,
                "Line Item Does Not Exist",
                "No line item at index " + error.index(),
                Map.of("index", error.index())
            );
        }

        @Override
        public ErrorView visitInvalidState(InvoiceError.InvalidState error) {
            return new ErrorView(
                HttpStatus.CONFLICT,
                "Invalid State",
                error.reason(),
                Map.of()
            );
        }
    };
}
