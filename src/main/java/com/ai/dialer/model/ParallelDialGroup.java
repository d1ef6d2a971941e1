package com.ai.dialer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A batch of simultaneous calls to one contact racing for the first human answer.
 * Mutated only through {@link com.ai.dialer.store.ParallelGroupStore#update}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString
public class ParallelDialGroup {

    private String groupId;

    private String queueId;

    private String holderId;

    private String conferenceName;

    @Builder.Default
    private ParallelGroupStatus status = ParallelGroupStatus.PENDING;

    private String winnerCallReference;

    @Builder.Default
    private List<ParallelCallAttempt> calls = new ArrayList<>();

    /** Legs the group will place; it cannot be exhausted before all of them are dialed. */
    private int expectedCalls;

    /** Callbacks that reached the group before their leg was recorded, in arrival order. */
    @JsonIgnore
    @Builder.Default
    private List<EarlyCallback> earlyCallbacks = new ArrayList<>();

    private Instant createdAt;

    public Optional<ParallelCallAttempt> findAttempt(String callReference) {
        return calls.stream()
                .filter(c -> Objects.equals(c.getCallReference(), callReference))
                .findFirst();
    }

    public boolean hasWinner() {
        return winnerCallReference != null;
    }

    public boolean isWinner(ParallelCallAttempt attempt) {
        return winnerCallReference != null && winnerCallReference.equals(attempt.getCallReference());
    }

    public boolean allAttemptsTerminal() {
        return !calls.isEmpty()
                && calls.size() >= expectedCalls
                && calls.stream().allMatch(ParallelCallAttempt::isTerminal);
    }

    public boolean isStillDialing() {
        return calls.size() < expectedCalls;
    }

    /** Removes and returns the held callbacks of one leg. */
    public List<EarlyCallback> takeEarlyCallbacks(String callReference) {
        List<EarlyCallback> taken = earlyCallbacks.stream()
                .filter(c -> c.callReference().equals(callReference))
                .toList();
        earlyCallbacks.removeAll(taken);
        return taken;
    }

    /** Deep copy so readers never observe a group mid-update. */
    public ParallelDialGroup copy() {
        List<ParallelCallAttempt> copied = new ArrayList<>(calls.size());
        for (ParallelCallAttempt call : calls) {
            copied.add(call.copy());
        }
        return toBuilder().calls(copied).earlyCallbacks(new ArrayList<>(earlyCallbacks)).build();
    }
}
