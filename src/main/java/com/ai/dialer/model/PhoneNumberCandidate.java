package com.ai.dialer.model;

/**
 * An outbound number the caller owns.
 */
public record PhoneNumberCandidate(String phoneNumber,
                                   String areaCode,
                                   boolean primary,
                                   boolean active,
                                   String city,
                                   String state) {

    public PhoneNumberCandidate(String phoneNumber, String areaCode, boolean primary, boolean active) {
        this(phoneNumber, areaCode, primary, active, null, null);
    }
}
