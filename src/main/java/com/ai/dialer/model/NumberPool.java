package com.ai.dialer.model;

import java.util.List;

/**
 * Snapshot of candidate outbound numbers supplied with a selection request.
 *
 * @param numbers       candidates in preference order
 * @param primaryNumber explicit primary; when null the first active number flagged primary is used
 */
public record NumberPool(List<PhoneNumberCandidate> numbers, PhoneNumberCandidate primaryNumber) {

    public NumberPool {
        numbers = numbers == null ? List.of() : List.copyOf(numbers);
    }

    public static NumberPool of(List<PhoneNumberCandidate> numbers) {
        return new NumberPool(numbers, null);
    }

    public static NumberPool empty() {
        return new NumberPool(List.of(), null);
    }
}
