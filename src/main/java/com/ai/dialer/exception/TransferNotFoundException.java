package com.ai.dialer.exception;

public class TransferNotFoundException extends NotFoundException {

    public TransferNotFoundException(String transferId) {
        super("Transfer not found: " + transferId, transferId);
    }
}
