package com.ai.dialer.model;

public enum TransferStatus {
    IDLE,
    INITIATING,
    CONSULTING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
