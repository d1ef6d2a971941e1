package com.ai.dialer.model;

public enum TransferOperation {
    COMPLETE,
    CANCEL
}
