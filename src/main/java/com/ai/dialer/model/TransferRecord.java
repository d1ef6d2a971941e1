package com.ai.dialer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString
public class TransferRecord {

    private String transferId;

    @Builder.Default
    private TransferStatus status = TransferStatus.IDLE;

    private TransferType transferType;

    private String recipientPhone;

    private String fromNumber;

    private String conferenceName;

    private String conferenceIdentifier;

    private String agentCallReference;

    private String customerCallReference;

    private String transferCallReference;

    private boolean customerMuted;

    /** First provider call that failed, when {@code status} is FAILED. */
    private TransferStep failedStep;

    private String failureReason;

    /** Complete or cancel currently running against this record. */
    private TransferOperation pendingOperation;

    private Instant initiatedAt;

    private Instant connectedAt;

    private Instant completedAt;

    public TransferRecord copy() {
        return toBuilder().build();
    }
}
