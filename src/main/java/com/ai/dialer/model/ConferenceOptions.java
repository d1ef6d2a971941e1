package com.ai.dialer.model;

/**
 * Attributes of the {@code <Conference>} verb generated for a leg joining a conference.
 */
public record ConferenceOptions(boolean startOnEnter,
                                boolean endOnExit,
                                boolean beep,
                                String waitUrl,
                                String participantLabel) {

    public static ConferenceOptions agent() {
        return new ConferenceOptions(true, false, true, null, ParticipantLabel.AGENT);
    }

    public static ConferenceOptions customer() {
        return new ConferenceOptions(true, false, false, null, ParticipantLabel.CUSTOMER);
    }
}
