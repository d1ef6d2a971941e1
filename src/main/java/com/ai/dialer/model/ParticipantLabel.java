package com.ai.dialer.model;

/**
 * Labels attached to conference legs so they can be found again in the participant list.
 */
public final class ParticipantLabel {

    public static final String AGENT = "agent";
    public static final String CUSTOMER = "customer";
    public static final String TRANSFER_TARGET = "transfer-target";

    private ParticipantLabel() {
    }
}
