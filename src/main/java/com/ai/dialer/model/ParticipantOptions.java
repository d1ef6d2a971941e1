package com.ai.dialer.model;

/**
 * How a leg joins a conference.
 *
 * @param statusCallbackUrl optional; when null no participant events are requested
 */
public record ParticipantOptions(String label, boolean endConferenceOnExit, String statusCallbackUrl) {

    public static ParticipantOptions of(String label, boolean endConferenceOnExit) {
        return new ParticipantOptions(label, endConferenceOnExit, null);
    }
}
