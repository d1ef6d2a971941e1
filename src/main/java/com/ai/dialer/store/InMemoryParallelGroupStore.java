package com.ai.dialer.store;

import com.ai.dialer.model.ParallelDialGroup;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Single-process group table. Entries expire {@code ttl} after their last write. Stored groups
 * are never mutated in place: updates work on a copy that replaces the entry.
 */
public class InMemoryParallelGroupStore implements ParallelGroupStore {

    private final Map<String, Expiring<ParallelDialGroup>> groups = new ConcurrentHashMap<>();
    private final Map<String, Expiring<String>> callMappings = new ConcurrentHashMap<>();
    private final Map<String, Expiring<String>> winners = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public InMemoryParallelGroupStore(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    @Override
    public void save(ParallelDialGroup group) {
        groups.put(group.getGroupId(), new Expiring<>(group.copy(), expiry()));
    }

    @Override
    public Optional<ParallelDialGroup> find(String groupId) {
        return live(groups, groupId).map(ParallelDialGroup::copy);
    }

    @Override
    public <R> Optional<R> update(String groupId, Function<ParallelDialGroup, R> mutation) {
        Instant now = clock.instant();
        AtomicReference<R> result = new AtomicReference<>();
        AtomicReference<Boolean> applied = new AtomicReference<>(false);
        groups.computeIfPresent(groupId, (id, entry) -> {
            if (entry.isExpired(now)) {
                return null;
            }
            ParallelDialGroup working = entry.value().copy();
            result.set(mutation.apply(working));
            applied.set(true);
            return new Expiring<>(working, expiry());
        });
        return applied.get() ? Optional.ofNullable(result.get()) : Optional.empty();
    }

    @Override
    public boolean setWinnerIfAbsent(String groupId, String callReference) {
        Instant now = clock.instant();
        AtomicReference<Boolean> won = new AtomicReference<>(false);
        winners.compute(groupId, (id, existing) -> {
            if (existing != null && !existing.isExpired(now)) {
                return existing;
            }
            won.set(true);
            return new Expiring<>(callReference, expiry());
        });
        return won.get();
    }

    @Override
    public Optional<String> findWinner(String groupId) {
        return live(winners, groupId);
    }

    @Override
    public void mapCall(String callReference, String groupId) {
        callMappings.put(callReference, new Expiring<>(groupId, expiry()));
    }

    @Override
    public Optional<String> findGroupIdForCall(String callReference) {
        return live(callMappings, callReference);
    }

    @Override
    public boolean exists(String groupId) {
        return live(groups, groupId).isPresent();
    }

    private Instant expiry() {
        return clock.instant().plus(ttl);
    }

    private <T> Optional<T> live(Map<String, Expiring<T>> map, String key) {
        Expiring<T> entry = map.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            map.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    private record Expiring<T>(T value, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !expiresAt.isAfter(now);
        }
    }
}
