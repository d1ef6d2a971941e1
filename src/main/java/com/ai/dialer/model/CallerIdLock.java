package com.ai.dialer.model;

import java.time.Instant;

/**
 * Exclusive hold of one outbound number by one call.
 */
public record CallerIdLock(String phoneNumber,
                           String holderId,
                           String callReference,
                           Instant acquiredAt,
                           Instant expiresAt) {

    /** A lock is absent for every purpose from its expiry instant onwards. */
    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public CallerIdLock withCallReference(String newCallReference, Instant newExpiresAt) {
        return new CallerIdLock(phoneNumber, holderId, newCallReference, acquiredAt, newExpiresAt);
    }
}
