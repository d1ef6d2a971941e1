package com.ai.dialer.store;

import com.ai.dialer.model.ParallelDialGroup;

import java.util.Optional;
import java.util.function.Function;

/**
 * Storage for parallel dial groups and the call-to-group index.
 */
public interface ParallelGroupStore {

    void save(ParallelDialGroup group);

    /** @return a snapshot; changes to it are not persisted */
    Optional<ParallelDialGroup> find(String groupId);

    /**
     * Applies {@code mutation} to the stored group. Updates to the same group never interleave,
     * so the mutation sees every earlier update and no concurrent one.
     *
     * @return the mutation's result, or empty when the group is unknown or expired
     */
    <R> Optional<R> update(String groupId, Function<ParallelDialGroup, R> mutation);

    /**
     * Compare-and-set on the group's winner slot.
     *
     * @return true only for the first caller per group
     */
    boolean setWinnerIfAbsent(String groupId, String callReference);

    Optional<String> findWinner(String groupId);

    void mapCall(String callReference, String groupId);

    Optional<String> findGroupIdForCall(String callReference);

    boolean exists(String groupId);
}
