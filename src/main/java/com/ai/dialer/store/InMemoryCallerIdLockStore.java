package com.ai.dialer.store;

import com.ai.dialer.model.CallerIdLock;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-process lock table. Per-number atomicity comes from {@link ConcurrentHashMap#compute}.
 */
public class InMemoryCallerIdLockStore implements CallerIdLockStore {

    private final Map<String, CallerIdLock> locks = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCallerIdLockStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean acquire(CallerIdLock lock) {
        purgeExpired();
        Instant now = clock.instant();
        AtomicBoolean acquired = new AtomicBoolean(false);
        locks.compute(lock.phoneNumber(), (number, existing) -> {
            if (existing != null && !existing.isExpired(now)
                    && !existing.callReference().equals(lock.callReference())) {
                return existing;
            }
            acquired.set(true);
            return lock;
        });
        return acquired.get();
    }

    @Override
    public boolean release(String callReference) {
        boolean released = false;
        for (Map.Entry<String, CallerIdLock> entry : locks.entrySet()) {
            if (entry.getValue().callReference().equals(callReference)) {
                released |= locks.remove(entry.getKey(), entry.getValue());
            }
        }
        return released;
    }

    @Override
    public boolean releaseByNumber(String phoneNumber) {
        CallerIdLock removed = locks.remove(phoneNumber);
        return removed != null && !removed.isExpired(clock.instant());
    }

    @Override
    public boolean isAvailable(String phoneNumber) {
        purgeExpired();
        return !locks.containsKey(phoneNumber);
    }

    @Override
    public Optional<CallerIdLock> findByCallReference(String callReference) {
        purgeExpired();
        return locks.values().stream()
                .filter(l -> l.callReference().equals(callReference))
                .findFirst();
    }

    @Override
    public List<CallerIdLock> findByHolder(String holderId) {
        purgeExpired();
        return locks.values().stream()
                .filter(l -> l.holderId().equals(holderId))
                .sorted(Comparator.comparing(CallerIdLock::acquiredAt))
                .toList();
    }

    @Override
    public boolean rebind(String phoneNumber, String fromCallReference, String toCallReference, Instant expiresAt) {
        Instant now = clock.instant();
        AtomicBoolean rebound = new AtomicBoolean(false);
        locks.computeIfPresent(phoneNumber, (number, existing) -> {
            if (existing.isExpired(now) || !existing.callReference().equals(fromCallReference)) {
                return existing;
            }
            rebound.set(true);
            return existing.withCallReference(toCallReference, expiresAt);
        });
        return rebound.get();
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = locks.size();
        locks.values().removeIf(l -> l.isExpired(now));
        return Math.max(0, before - locks.size());
    }
}
