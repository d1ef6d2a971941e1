package com.ai.dialer.store;

import com.ai.dialer.entity.TransferRecordEntity;
import com.ai.dialer.model.TransferOperation;
import com.ai.dialer.model.TransferRecord;
import com.ai.dialer.model.TransferStatus;
import com.ai.dialer.repository.TransferRecordRepository;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

public class JpaTransferStore implements TransferStore {

    private final TransferRecordRepository repository;
    private final TransactionTemplate transactionTemplate;

    public JpaTransferStore(TransferRecordRepository repository, TransactionTemplate transactionTemplate) {
        this.repository = repository;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public TransferRecord save(TransferRecord record) {
        transactionTemplate.executeWithoutResult(status -> repository.save(toEntity(record)));
        return record;
    }

    @Override
    public Optional<TransferRecord> find(String transferId) {
        return repository.findById(transferId).map(JpaTransferStore::toModel);
    }

    /** Conditional update; true only when this caller moved the record into the operation. */
    @Override
    public boolean claimOperation(String transferId, TransferStatus expected, TransferOperation operation) {
        Integer updated = transactionTemplate.execute(
                status -> repository.claimOperation(transferId, expected, operation));
        return updated != null && updated == 1;
    }

    private static TransferRecordEntity toEntity(TransferRecord record) {
        return TransferRecordEntity.builder()
                .transferId(record.getTransferId())
                .status(record.getStatus())
                .transferType(record.getTransferType())
                .recipientPhone(record.getRecipientPhone())
                .fromNumber(record.getFromNumber())
                .conferenceName(record.getConferenceName())
                .conferenceIdentifier(record.getConferenceIdentifier())
                .agentCallReference(record.getAgentCallReference())
                .customerCallReference(record.getCustomerCallReference())
                .transferCallReference(record.getTransferCallReference())
                .customerMuted(record.isCustomerMuted())
                .failedStep(record.getFailedStep())
                .failureReason(record.getFailureReason())
                .pendingOperation(record.getPendingOperation())
                .initiatedAt(record.getInitiatedAt())
                .connectedAt(record.getConnectedAt())
                .completedAt(record.getCompletedAt())
                .build();
    }

    private static TransferRecord toModel(TransferRecordEntity entity) {
        return TransferRecord.builder()
                .transferId(entity.getTransferId())
                .status(entity.getStatus())
                .transferType(entity.getTransferType())
                .recipientPhone(entity.getRecipientPhone())
                .fromNumber(entity.getFromNumber())
                .conferenceName(entity.getConferenceName())
                .conferenceIdentifier(entity.getConferenceIdentifier())
                .agentCallReference(entity.getAgentCallReference())
                .customerCallReference(entity.getCustomerCallReference())
                .transferCallReference(entity.getTransferCallReference())
                .customerMuted(entity.isCustomerMuted())
                .failedStep(entity.getFailedStep())
                .failureReason(entity.getFailureReason())
                .pendingOperation(entity.getPendingOperation())
                .initiatedAt(entity.getInitiatedAt())
                .connectedAt(entity.getConnectedAt())
                .completedAt(entity.getCompletedAt())
                .build();
    }
}
