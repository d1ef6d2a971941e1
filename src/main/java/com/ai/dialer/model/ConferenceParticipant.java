package com.ai.dialer.model;

public record ConferenceParticipant(String callReference,
                                    String conferenceIdentifier,
                                    String label,
                                    boolean hold,
                                    boolean muted,
                                    String status) {

    public boolean hasLabel(String expected) {
        return expected.equals(label);
    }
}
