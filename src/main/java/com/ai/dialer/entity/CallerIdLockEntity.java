package com.ai.dialer.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One row per locked outbound number; the primary key enforces a single holder.
 */
@Entity
@Table(name = "caller_id_lock", indexes = {
    @Index(name = "idx_caller_id_lock_call_ref", columnList = "call_reference"),
    @Index(name = "idx_caller_id_lock_holder", columnList = "holder_id"),
    @Index(name = "idx_caller_id_lock_expires", columnList = "expires_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CallerIdLockEntity {

    @Id
    @Column(name = "phone_number", length = 20)
    private String phoneNumber;

    @Column(name = "holder_id", nullable = false)
    private String holderId;

    @Column(name = "call_reference", nullable = false, length = 64)
    private String callReference;

    @Column(name = "acquired_at", nullable = false)
    private Instant acquiredAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;
}
