package com.ai.dialer.exception;

/**
 * Base exception for all dialer errors. Subclasses map to distinct HTTP outcomes
 * in {@link com.ai.dialer.controller.GlobalExceptionHandler}.
 */
public class DialerException extends RuntimeException {

    public DialerException(String message) {
        super(message);
    }

    public DialerException(String message, Throwable cause) {
        super(message, cause);
    }
}
