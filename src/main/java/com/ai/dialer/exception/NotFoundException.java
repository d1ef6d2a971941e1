package com.ai.dialer.exception;

/**
 * A referenced group, transfer or conference does not exist (or no longer exists).
 * Distinct from {@link TelephonyException} so callers can decide to retry later.
 */
public abstract class NotFoundException extends DialerException {

    private final String reference;

    protected NotFoundException(String message, String reference) {
        super(message);
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
