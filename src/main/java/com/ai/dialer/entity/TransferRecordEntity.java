package com.ai.dialer.entity;

import com.ai.dialer.model.TransferOperation;
import com.ai.dialer.model.TransferStatus;
import com.ai.dialer.model.TransferStep;
import com.ai.dialer.model.TransferType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "transfer_record")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TransferRecordEntity {

    @Id
    @Column(name = "transfer_id", length = 40)
    private String transferId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TransferStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "transfer_type", nullable = false, length = 10)
    private TransferType transferType;

    @Column(name = "recipient_phone", nullable = false, length = 20)
    private String recipientPhone;

    @Column(name = "from_number", length = 20)
    private String fromNumber;

    @Column(name = "conference_name", nullable = false)
    private String conferenceName;

    @Column(name = "conference_identifier", length = 64)
    private String conferenceIdentifier;

    @Column(name = "agent_call_reference", length = 64)
    private String agentCallReference;

    @Column(name = "customer_call_reference", length = 64)
    private String customerCallReference;

    @Column(name = "transfer_call_reference", length = 64)
    private String transferCallReference;

    @Column(name = "customer_muted", nullable = false)
    private boolean customerMuted;

    @Enumerated(EnumType.STRING)
    @Column(name = "failed_step", length = 20)
    private TransferStep failedStep;

    @Column(name = "failure_reason", length = 500)
    private String failureReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "pending_operation", length = 10)
    private TransferOperation pendingOperation;

    @Column(name = "initiated_at")
    private Instant initiatedAt;

    @Column(name = "connected_at")
    private Instant connectedAt;

    @Column(name = "completed_at")
    private Instant completedAt;
}
