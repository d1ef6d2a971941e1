package com.ai.dialer.model;

/**
 * Individual provider calls making up a transfer sequence. Recorded on failure.
 */
public enum TransferStep {
    LOOKUP_CUSTOMER,
    HOLD_CUSTOMER,
    ADD_TARGET,
    REMOVE_AGENT,
    UNHOLD_CUSTOMER,
    PROMOTE_TARGET,
    REMOVE_TARGET
}
