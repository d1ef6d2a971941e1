package com.ai.dialer.exception;

/**
 * The outbound number is held by another call. Callers pick another number or abort;
 * the same number is never retried automatically.
 */
public class CallerIdLockedException extends DialerException {

    private final String phoneNumber;

    public CallerIdLockedException(String phoneNumber) {
        super("Caller ID " + phoneNumber + " is in use by another call");
        this.phoneNumber = phoneNumber;
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }
}
