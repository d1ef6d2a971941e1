package com.ai.dialer.model;

public enum ParallelGroupStatus {
    PENDING,
    DIALING,
    /** Winner committed, winning call live. */
    CONNECTED,
    COMPLETED,
    FAILED,
    TERMINATED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TERMINATED;
    }

    /** Once a winner exists, non-winning identities can be handed back. */
    public boolean hasReleasableNumbers() {
        return this == CONNECTED || this == COMPLETED;
    }
}
