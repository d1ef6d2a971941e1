package com.ai.dialer.service;

import com.ai.dialer.config.DialerProperties;
import com.ai.dialer.model.CallerIdLock;
import com.ai.dialer.store.CallerIdLockStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Mutual exclusion over outbound numbers so no two live calls present the same caller ID.
 * Acquisition never blocks: a busy number is reported as {@code false} and the caller picks
 * another number or gives up.
 */
@Service
public class CallerIdLockService {

    private static final Logger log = LoggerFactory.getLogger(CallerIdLockService.class);

    private final CallerIdLockStore store;
    private final Clock clock;
    private final Duration ttl;

    public CallerIdLockService(CallerIdLockStore store, Clock clock, DialerProperties properties) {
        this.store = store;
        this.clock = clock;
        this.ttl = properties.getLock().getTtl();
    }

    /**
     * Locks {@code phoneNumber} for {@code callReference}. Re-acquiring with the same call
     * reference refreshes the expiry.
     */
    public boolean acquire(String phoneNumber, String holderId, String callReference) {
        Instant now = clock.instant();
        boolean acquired = store.acquire(new CallerIdLock(phoneNumber, holderId, callReference, now, now.plus(ttl)));
        if (acquired) {
            log.debug("Caller ID {} locked by {} for {}", phoneNumber, holderId, callReference);
        } else {
            log.info("Caller ID {} busy; lock refused for {}", phoneNumber, callReference);
        }
        return acquired;
    }

    /**
     * Moves a provisional lock to the provider call reference once the call exists, refreshing
     * its expiry.
     */
    public boolean rebind(String phoneNumber, String provisionalReference, String callReference) {
        boolean rebound = store.rebind(phoneNumber, provisionalReference, callReference, clock.instant().plus(ttl));
        if (!rebound) {
            log.warn("Caller ID {} no longer held by {}; could not rebind to {}", phoneNumber, provisionalReference, callReference);
        }
        return rebound;
    }

    public boolean release(String callReference) {
        boolean released = store.release(callReference);
        if (released) {
            log.debug("Released caller ID lock for {}", callReference);
        }
        return released;
    }

    public boolean releaseByNumber(String phoneNumber) {
        return store.releaseByNumber(phoneNumber);
    }

    public boolean isAvailable(String phoneNumber) {
        return store.isAvailable(phoneNumber);
    }

    public Optional<CallerIdLock> findByCallReference(String callReference) {
        return store.findByCallReference(callReference);
    }

    public List<CallerIdLock> listByHolder(String holderId) {
        return store.findByHolder(holderId);
    }

    public int purgeExpired() {
        return store.purgeExpired();
    }
}
