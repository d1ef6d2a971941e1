package com.ai.dialer.service;

import com.ai.dialer.dto.TransferRequest;
import com.ai.dialer.exception.InvalidTransferStateException;
import com.ai.dialer.exception.TelephonyException;
import com.ai.dialer.exception.TransferNotFoundException;
import com.ai.dialer.model.AddedParticipant;
import com.ai.dialer.model.ConferenceParticipant;
import com.ai.dialer.model.ParticipantLabel;
import com.ai.dialer.model.ParticipantOptions;
import com.ai.dialer.model.TransferOperation;
import com.ai.dialer.model.TransferRecord;
import com.ai.dialer.model.TransferStatus;
import com.ai.dialer.model.TransferStep;
import com.ai.dialer.model.TransferType;
import com.ai.dialer.store.TransferStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Cold and warm transfers inside a conference.
 *
 * <pre>
 * IDLE -> INITIATING -> COMPLETED                  (cold)
 * IDLE -> INITIATING -> CONSULTING -> COMPLETED    (warm, complete)
 *                                  -> CANCELLED    (warm, cancel)
 * any step failure                 -> FAILED
 * </pre>
 *
 * Provider steps are not transactional. When one fails the record keeps the step and the
 * references gathered so far, and later steps are skipped.
 */
@Service
public class TransferService {

    private static final Logger log = LoggerFactory.getLogger(TransferService.class);

    private final TransferStore store;
    private final ConferenceService conferenceService;
    private final TelephonyGateway telephony;
    private final Clock clock;

    public TransferService(TransferStore store, ConferenceService conferenceService,
                           TelephonyGateway telephony, Clock clock) {
        this.store = store;
        this.conferenceService = conferenceService;
        this.telephony = telephony;
        this.clock = clock;
    }

    /**
     * Starts a transfer. Step failures are recorded on the returned record rather than thrown.
     *
     * @throws com.ai.dialer.exception.ConferenceNotFoundException when the conference is not in
     *                                                             progress; no record is created
     */
    public TransferRecord initiateTransfer(TransferRequest request) {
        String conferenceId = conferenceService.requireConference(request.conferenceName());

        TransferRecord record = TransferRecord.builder()
                .transferId("tr_" + UUID.randomUUID().toString().replace("-", ""))
                .status(TransferStatus.INITIATING)
                .transferType(request.type())
                .recipientPhone(request.recipientPhone())
                .fromNumber(request.fromNumber())
                .conferenceName(request.conferenceName())
                .conferenceIdentifier(conferenceId)
                .agentCallReference(request.agentCallReference())
                .initiatedAt(clock.instant())
                .build();
        store.save(record);
        log.info("Transfer {} ({}) to {} started in conference {}", record.getTransferId(),
                request.type(), request.recipientPhone(), request.conferenceName());

        TransferRecord result = request.type() == TransferType.COLD ? coldTransfer(record) : warmTransfer(record);
        return store.save(result);
    }

    /**
     * Connects the customer to the consulted target and drops the agent. Completing an already
     * completed transfer returns it unchanged.
     */
    public TransferRecord completeTransfer(String transferId) {
        TransferRecord current = getTransfer(transferId);
        if (current.getStatus() == TransferStatus.COMPLETED) {
            return current;
        }
        if (!store.claimOperation(transferId, TransferStatus.CONSULTING, TransferOperation.COMPLETE)) {
            throw new InvalidTransferStateException(transferId, current.getStatus(), "complete");
        }
        TransferRecord record = getTransfer(transferId);
        String conferenceId = record.getConferenceIdentifier();

        try {
            if (record.getCustomerCallReference() != null) {
                telephony.holdParticipant(conferenceId, record.getCustomerCallReference(), false);
                record.setCustomerMuted(false);
            }
        } catch (TelephonyException e) {
            return store.save(fail(record, TransferStep.UNHOLD_CUSTOMER, e));
        }
        try {
            telephony.setEndConferenceOnExit(conferenceId, record.getTransferCallReference(), true);
        } catch (TelephonyException e) {
            return store.save(fail(record, TransferStep.PROMOTE_TARGET, e));
        }
        try {
            telephony.removeParticipant(conferenceId, record.getAgentCallReference());
        } catch (TelephonyException e) {
            return store.save(fail(record, TransferStep.REMOVE_AGENT, e));
        }

        record.setStatus(TransferStatus.COMPLETED);
        record.setCompletedAt(clock.instant());
        record.setPendingOperation(null);
        log.info("Transfer {} completed", transferId);
        return store.save(record);
    }

    /**
     * Drops the consulted target and gives the customer back to the agent. Also recovers a
     * warm transfer that failed while the customer was on hold. Cancelling an already cancelled
     * transfer returns it unchanged.
     */
    public TransferRecord cancelTransfer(String transferId) {
        TransferRecord current = getTransfer(transferId);
        if (current.getStatus() == TransferStatus.CANCELLED) {
            return current;
        }
        boolean claimed = switch (current.getStatus()) {
            case CONSULTING -> store.claimOperation(transferId, TransferStatus.CONSULTING, TransferOperation.CANCEL);
            case FAILED -> current.isCustomerMuted()
                    && store.claimOperation(transferId, TransferStatus.FAILED, TransferOperation.CANCEL);
            default -> false;
        };
        if (!claimed) {
            throw new InvalidTransferStateException(transferId, current.getStatus(), "cancel");
        }
        TransferRecord record = getTransfer(transferId);
        String conferenceId = record.getConferenceIdentifier();

        TelephonyException firstFailure = null;
        TransferStep failedStep = null;
        if (record.getTransferCallReference() != null) {
            try {
                telephony.removeParticipant(conferenceId, record.getTransferCallReference());
            } catch (TelephonyException e) {
                firstFailure = e;
                failedStep = TransferStep.REMOVE_TARGET;
            }
        }
        if (record.getCustomerCallReference() != null && record.isCustomerMuted()) {
            try {
                telephony.holdParticipant(conferenceId, record.getCustomerCallReference(), false);
                record.setCustomerMuted(false);
            } catch (TelephonyException e) {
                if (firstFailure == null) {
                    firstFailure = e;
                    failedStep = TransferStep.UNHOLD_CUSTOMER;
                } else {
                    log.warn("Transfer {}: unhold also failed: {}", transferId, e.getMessage());
                }
            }
        }
        if (firstFailure != null) {
            return store.save(fail(record, failedStep, firstFailure));
        }

        record.setStatus(TransferStatus.CANCELLED);
        record.setCompletedAt(clock.instant());
        record.setPendingOperation(null);
        record.setFailedStep(null);
        record.setFailureReason(null);
        log.info("Transfer {} cancelled", transferId);
        return store.save(record);
    }

    public TransferRecord getTransfer(String transferId) {
        return store.find(transferId).orElseThrow(() -> new TransferNotFoundException(transferId));
    }

    private TransferRecord coldTransfer(TransferRecord record) {
        String conferenceId = record.getConferenceIdentifier();
        try {
            AddedParticipant target = telephony.addParticipant(conferenceId, record.getRecipientPhone(),
                    record.getFromNumber(), ParticipantOptions.of(ParticipantLabel.TRANSFER_TARGET, true));
            record.setTransferCallReference(target.callReference());
        } catch (TelephonyException e) {
            return fail(record, TransferStep.ADD_TARGET, e);
        }
        try {
            telephony.removeParticipant(conferenceId, record.getAgentCallReference());
        } catch (TelephonyException e) {
            return fail(record, TransferStep.REMOVE_AGENT, e);
        }
        record.setStatus(TransferStatus.COMPLETED);
        record.setConnectedAt(clock.instant());
        record.setCompletedAt(clock.instant());
        log.info("Cold transfer {} completed", record.getTransferId());
        return record;
    }

    private TransferRecord warmTransfer(TransferRecord record) {
        String conferenceId = record.getConferenceIdentifier();
        Optional<ConferenceParticipant> customer;
        try {
            customer = telephony.listParticipants(conferenceId).stream()
                    .filter(p -> p.hasLabel(ParticipantLabel.CUSTOMER))
                    .findFirst();
        } catch (TelephonyException e) {
            return fail(record, TransferStep.LOOKUP_CUSTOMER, e);
        }
        if (customer.isPresent()) {
            record.setCustomerCallReference(customer.get().callReference());
            try {
                telephony.holdParticipant(conferenceId, customer.get().callReference(), true);
                record.setCustomerMuted(true);
            } catch (TelephonyException e) {
                return fail(record, TransferStep.HOLD_CUSTOMER, e);
            }
        } else {
            log.warn("Transfer {}: no customer leg in conference {}; consulting without hold",
                    record.getTransferId(), record.getConferenceName());
        }
        try {
            AddedParticipant target = telephony.addParticipant(conferenceId, record.getRecipientPhone(),
                    record.getFromNumber(), ParticipantOptions.of(ParticipantLabel.TRANSFER_TARGET, false));
            record.setTransferCallReference(target.callReference());
        } catch (TelephonyException e) {
            return fail(record, TransferStep.ADD_TARGET, e);
        }
        record.setStatus(TransferStatus.CONSULTING);
        record.setConnectedAt(clock.instant());
        log.info("Warm transfer {} consulting with {}", record.getTransferId(), record.getRecipientPhone());
        return record;
    }

    private TransferRecord fail(TransferRecord record, TransferStep step, TelephonyException e) {
        log.error("Transfer {} failed at {}: {}", record.getTransferId(), step, e.getMessage());
        record.setStatus(TransferStatus.FAILED);
        record.setFailedStep(step);
        record.setFailureReason(e.getMessage());
        record.setPendingOperation(null);
        return record;
    }
}
