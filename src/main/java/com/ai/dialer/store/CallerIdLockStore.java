package com.ai.dialer.store;

import com.ai.dialer.model.CallerIdLock;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage for caller ID locks. Implementations must make {@link #acquire} and {@link #rebind}
 * atomic per phone number and treat expired locks as absent in every operation.
 */
public interface CallerIdLockStore {

    /**
     * Stores the lock unless a live lock with a different call reference holds the number.
     * A live lock with the same call reference is replaced (refreshed).
     */
    boolean acquire(CallerIdLock lock);

    /** Removes every lock held by the call reference. */
    boolean release(String callReference);

    boolean releaseByNumber(String phoneNumber);

    boolean isAvailable(String phoneNumber);

    Optional<CallerIdLock> findByCallReference(String callReference);

    List<CallerIdLock> findByHolder(String holderId);

    /**
     * Moves a live lock on {@code phoneNumber} from one call reference to another.
     *
     * @return false when the number is not held by {@code fromCallReference}
     */
    boolean rebind(String phoneNumber, String fromCallReference, String toCallReference, Instant expiresAt);

    /** @return number of expired locks removed */
    int purgeExpired();
}
