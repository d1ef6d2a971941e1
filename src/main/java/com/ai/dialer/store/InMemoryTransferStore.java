package com.ai.dialer.store;

import com.ai.dialer.model.TransferOperation;
import com.ai.dialer.model.TransferRecord;
import com.ai.dialer.model.TransferStatus;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

public class InMemoryTransferStore implements TransferStore {

    private final Map<String, TransferRecord> records = new ConcurrentHashMap<>();

    @Override
    public TransferRecord save(TransferRecord record) {
        records.put(record.getTransferId(), record.copy());
        return record;
    }

    @Override
    public Optional<TransferRecord> find(String transferId) {
        return Optional.ofNullable(records.get(transferId)).map(TransferRecord::copy);
    }

    @Override
    public boolean claimOperation(String transferId, TransferStatus expected, TransferOperation operation) {
        AtomicReference<Boolean> claimed = new AtomicReference<>(false);
        records.computeIfPresent(transferId, (id, record) -> {
            if (record.getStatus() != expected || record.getPendingOperation() != null) {
                return record;
            }
            TransferRecord updated = record.copy();
            updated.setPendingOperation(operation);
            claimed.set(true);
            return updated;
        });
        return claimed.get();
    }
}
