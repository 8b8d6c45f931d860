package com.flagship.invoices.invoice.exception;

import com.flagship.invoices.invoice.CorruptEventLogException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps rejected commands and infrastructure failures to {@link ApiError} responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(CommandRejectedException.class)
    public ResponseEntity<ApiError> handleRejected(CommandRejectedException e) {
        ErrorView view = ErrorView.of(e.getError());
        log.warn("Command {} rejected: {}", e.getCommandId(), view.getMessage());

        Map<String, Object> details = new LinkedHashMap<>(view.getDetails());
        details.put("origin_id", e.getOriginId());
        details.put("command_id", e.getCommandId());

        return ResponseEntity.status(view.getStatus()).body(ApiError.builder()
            .error(view.getCode())
            .message(view.getMessage())
            .details(details)
            .timestamp(Instant.now())
            .build());
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());

        return badRequest("Missing Required Header",
            "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid value for {}: {}", e.getName(), e.getValue());

        return badRequest("Invalid Request",
            "Invalid value for '" + e.getName() + "': " + e.getValue(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, Object> errors = new LinkedHashMap<>();
        e.getBindingResult().getFieldErrors().forEach(error -> errors.putIfAbsent(
            error.getField(),
            error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value"
        ));

        return badRequest("Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Malformed request body: {}", e.getMessage());

        return badRequest("Malformed Request", "Request body could not be read", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());

        return badRequest("Invalid Request", e.getMessage(), null);
    }

    /**
     * Two first writes for the same invoice or two executions of the same command
     * raced; the loser rolled back.
     */
    @ExceptionHandler({DataIntegrityViolationException.class, OptimisticLockingFailureException.class})
    public ResponseEntity<ApiError> handleConcurrentWrite(RuntimeException e) {
        log.warn("Concurrent write rejected: {}", e.getMessage());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiError.builder()
            .error("Concurrent Modification")
            .message("The invoice was modified concurrently, re-read it and retry")
            .timestamp(Instant.now())
            .build());
    }

    @ExceptionHandler(CorruptEventLogException.class)
    public ResponseEntity<ApiError> handleCorruptLog(CorruptEventLogException e) {
        log.error("Event log integrity fault", e);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiError.builder()
            .error("Event Log Corrupt")
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiError.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build());
    }

    private ResponseEntity<ApiError> badRequest(String error, String message, Map<String, Object> details) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiError.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build());
    }
}
