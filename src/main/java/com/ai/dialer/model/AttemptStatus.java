package com.ai.dialer.model;

/**
 * Status of one leg in a parallel dial group. Declaration order is progress order.
 */
public enum AttemptStatus {
    INITIATED,
    RINGING,
    ANSWERED,
    NO_ANSWER,
    BUSY,
    FAILED,
    TERMINATED;

    public boolean isTerminal() {
        return this == NO_ANSWER || this == BUSY || this == FAILED || this == TERMINATED;
    }

    public boolean isBefore(AttemptStatus other) {
        return ordinal() < other.ordinal();
    }
}
