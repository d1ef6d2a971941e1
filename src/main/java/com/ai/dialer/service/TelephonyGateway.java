package com.ai.dialer.service;

import com.ai.dialer.model.AddedParticipant;
import com.ai.dialer.model.ConferenceParticipant;
import com.ai.dialer.model.OutboundCall;
import com.ai.dialer.model.ParticipantOptions;

import java.util.List;
import java.util.Optional;

/**
 * Network calls made against the telephony provider. Every method throws
 * {@link com.ai.dialer.exception.TelephonyException} when the provider rejects the request.
 */
public interface TelephonyGateway {

    /** @return the provider's call reference */
    String dial(OutboundCall call);

    void hangup(String callReference);

    /** Dials {@code to} into an existing conference. */
    AddedParticipant addParticipant(String conferenceIdentifier, String to, String from, ParticipantOptions options);

    void removeParticipant(String conferenceIdentifier, String callReference);

    void holdParticipant(String conferenceIdentifier, String callReference, boolean hold);

    void muteParticipant(String conferenceIdentifier, String callReference, boolean muted);

    void setEndConferenceOnExit(String conferenceIdentifier, String callReference, boolean endConferenceOnExit);

    List<ConferenceParticipant> listParticipants(String conferenceIdentifier);

    /** @return the in-progress conference with this friendly name, if any */
    Optional<String> findConferenceId(String conferenceName);
}
