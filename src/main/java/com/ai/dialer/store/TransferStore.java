package com.ai.dialer.store;

import com.ai.dialer.model.TransferOperation;
import com.ai.dialer.model.TransferRecord;
import com.ai.dialer.model.TransferStatus;

import java.util.Optional;

/**
 * Storage for transfer records. Records are never deleted.
 */
public interface TransferStore {

    TransferRecord save(TransferRecord record);

    /** @return a snapshot of the record */
    Optional<TransferRecord> find(String transferId);

    /**
     * Atomically marks {@code operation} as running when the record is in {@code expected}
     * status and no other operation is running.
     */
    boolean claimOperation(String transferId, TransferStatus expected, TransferOperation operation);
}
