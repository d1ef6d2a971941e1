package com.ai.dialer.model;

public enum TransferType {
    /** Agent drops as soon as the target joins. */
    COLD,
    /** Customer is held while the agent briefs the target. */
    WARM
}
