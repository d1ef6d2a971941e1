package com.ai.dialer.controller;

import com.ai.dialer.exception.CallerIdLockedException;
import com.ai.dialer.exception.InvalidDialRequestException;
import com.ai.dialer.exception.InvalidTransferStateException;
import com.ai.dialer.exception.NotFoundException;
import com.ai.dialer.exception.TelephonyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps dialer exceptions to HTTP responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Resource conflict (HTTP 409). The caller should pick another number or wait.
     */
    @ExceptionHandler(CallerIdLockedException.class)
    ResponseEntity<ApiError> handleLocked(CallerIdLockedException ex) {
        log.info("Caller ID busy: {}", ex.getPhoneNumber());
        return error(HttpStatus.CONFLICT, "CALLER_ID_LOCKED", ex.getMessage());
    }

    @ExceptionHandler(InvalidTransferStateException.class)
    ResponseEntity<ApiError> handleTransferState(InvalidTransferStateException ex) {
        log.info("Rejected transfer command: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, "INVALID_TRANSFER_STATE", ex.getMessage());
    }

    @ExceptionHandler(NotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(NotFoundException ex) {
        log.debug("Not found: {}", ex.getReference());
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage());
    }

    /**
     * Upstream failure (HTTP 502). Never retried here.
     */
    @ExceptionHandler(TelephonyException.class)
    ResponseEntity<ApiError> handleTelephony(TelephonyException ex) {
        log.error("Telephony provider error during {}", ex.getOperation(), ex);
        return error(HttpStatus.BAD_GATEWAY, "TELEPHONY_ERROR", ex.getMessage());
    }

    @ExceptionHandler(InvalidDialRequestException.class)
    ResponseEntity<ApiError> handleInvalidRequest(InvalidDialRequestException ex) {
        log.warn("Invalid dial request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", message);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleMalformed(Exception ex) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMessage());
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ApiError(code, message, Instant.now()));
    }

    public record ApiError(String errorCode, String message, Instant timestamp) {
    }
}
