package com.ai.dialer.exception;

/**
 * The telephony provider rejected or failed a request. Never retried by the core.
 */
public class TelephonyException extends DialerException {

    private final String operation;

    public TelephonyException(String operation, String message) {
        super(operation + " failed: " + message);
        this.operation = operation;
    }

    public TelephonyException(String operation, String message, Throwable cause) {
        super(operation + " failed: " + message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
