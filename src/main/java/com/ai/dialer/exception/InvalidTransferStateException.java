package com.ai.dialer.exception;

import com.ai.dialer.model.TransferStatus;

public class InvalidTransferStateException extends DialerException {

    private final String transferId;
    private final TransferStatus status;

    public InvalidTransferStateException(String transferId, TransferStatus status, String action) {
        super("Cannot " + action + " transfer " + transferId + " in status " + status);
        this.transferId = transferId;
        this.status = status;
    }

    public String getTransferId() {
        return transferId;
    }

    public TransferStatus getStatus() {
        return status;
    }
}
