package com.ai.dialer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString
public class ParallelCallAttempt {

    private String callReference;

    private String customerNumber;

    private String fromNumber;

    /** 1-based dial order within the group. */
    private int position;

    @Builder.Default
    private AttemptStatus status = AttemptStatus.INITIATED;

    private AnsweredBy answeredBy;

    private String contactId;

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public ParallelCallAttempt copy() {
        return toBuilder().build();
    }
}
