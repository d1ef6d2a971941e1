package com.ai.dialer.service;

import com.ai.dialer.component.ConferenceTwimlBuilder;
import com.ai.dialer.exception.ConferenceNotFoundException;
import com.ai.dialer.model.AddedParticipant;
import com.ai.dialer.model.ConferenceOptions;
import com.ai.dialer.model.ConferenceParticipant;
import com.ai.dialer.model.ParticipantOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Conference lookups and per-leg controls. Conferences are addressed by friendly name; the
 * provider identifier is resolved on every call since a conference only exists while in progress.
 */
@Service
public class ConferenceService {

    private static final Logger log = LoggerFactory.getLogger(ConferenceService.class);

    private final TelephonyGateway telephony;
    private final ConferenceTwimlBuilder twimlBuilder;

    public ConferenceService(TelephonyGateway telephony, ConferenceTwimlBuilder twimlBuilder) {
        this.telephony = telephony;
        this.twimlBuilder = twimlBuilder;
    }

    public Optional<String> findConference(String conferenceName) {
        return telephony.findConferenceId(conferenceName);
    }

    /**
     * @throws ConferenceNotFoundException when no conference with this name is in progress;
     *                                     the caller may retry once the first leg has joined
     */
    public String requireConference(String conferenceName) {
        return findConference(conferenceName)
                .orElseThrow(() -> new ConferenceNotFoundException(conferenceName));
    }

    public List<ConferenceParticipant> listParticipants(String conferenceName) {
        return telephony.listParticipants(requireConference(conferenceName));
    }

    /** Sets the hold state of one leg. Holding an already held leg is harmless. */
    public void holdParticipant(String conferenceName, String callReference, boolean hold) {
        String conferenceId = requireConference(conferenceName);
        telephony.holdParticipant(conferenceId, callReference, hold);
        log.info("{} {} in conference {}", hold ? "Held" : "Resumed", callReference, conferenceName);
    }

    public void muteParticipant(String conferenceName, String callReference, boolean muted) {
        String conferenceId = requireConference(conferenceName);
        telephony.muteParticipant(conferenceId, callReference, muted);
        log.info("{} {} in conference {}", muted ? "Muted" : "Unmuted", callReference, conferenceName);
    }

    public AddedParticipant addParticipant(String conferenceName, String to, String from, ParticipantOptions options) {
        return telephony.addParticipant(requireConference(conferenceName), to, from, options);
    }

    public String generateConferenceTwiml(String conferenceName, ConferenceOptions options) {
        return twimlBuilder.joinConference(conferenceName, options);
    }
}
