package com.ai.dialer.service;

import com.ai.dialer.exception.TelephonyException;
import com.ai.dialer.model.AddedParticipant;
import com.ai.dialer.model.ConferenceParticipant;
import com.ai.dialer.model.OutboundCall;
import com.ai.dialer.model.ParticipantOptions;
import com.twilio.exception.TwilioException;
import com.twilio.http.HttpMethod;
import com.twilio.http.TwilioRestClient;
import com.twilio.rest.api.v2010.account.Call;
import com.twilio.rest.api.v2010.account.CallCreator;
import com.twilio.rest.api.v2010.account.Conference;
import com.twilio.rest.api.v2010.account.conference.Participant;
import com.twilio.rest.api.v2010.account.conference.ParticipantCreator;
import com.twilio.type.PhoneNumber;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
public class TwilioTelephonyGateway implements TelephonyGateway {

    private static final Logger log = LoggerFactory.getLogger(TwilioTelephonyGateway.class);

    private static final List<String> CALL_EVENTS = List.of("initiated", "ringing", "answered", "completed");
    private static final List<String> PARTICIPANT_EVENTS = List.of("ringing", "answered", "completed");

    private final TwilioRestClient client;

    public TwilioTelephonyGateway(TwilioRestClient client) {
        this.client = client;
    }

    @Override
    public String dial(OutboundCall call) {
        try {
            CallCreator creator = Call.creator(new PhoneNumber(call.to()), new PhoneNumber(call.from()),
                    URI.create(call.twimlUrl()));
            if (StringUtils.isNotBlank(call.statusCallbackUrl())) {
                creator.setStatusCallback(URI.create(call.statusCallbackUrl()))
                        .setStatusCallbackEvent(CALL_EVENTS)
                        .setStatusCallbackMethod(HttpMethod.POST);
            }
            if (call.machineDetection()) {
                creator.setMachineDetection("Enable");
            }
            Call created = creator.create(client);
            log.info("Placed call {} to {} from {}", created.getSid(), call.to(), call.from());
            return created.getSid();
        } catch (TwilioException e) {
            log.error("Twilio dial failed to {} from {}", call.to(), call.from(), e);
            throw new TelephonyException("dial", e.getMessage(), e);
        }
    }

    @Override
    public void hangup(String callReference) {
        try {
            Call.updater(callReference).setStatus(Call.UpdateStatus.COMPLETED).update(client);
            log.info("Terminated call via REST API: {}", callReference);
        } catch (TwilioException e) {
            throw new TelephonyException("hangup", e.getMessage(), e);
        }
    }

    @Override
    public AddedParticipant addParticipant(String conferenceIdentifier, String to, String from, ParticipantOptions options) {
        try {
            ParticipantCreator creator = Participant.creator(conferenceIdentifier, new PhoneNumber(from), new PhoneNumber(to))
                    .setEndConferenceOnExit(options.endConferenceOnExit())
                    .setLabel(options.label());
            if (StringUtils.isNotBlank(options.statusCallbackUrl())) {
                creator.setStatusCallback(URI.create(options.statusCallbackUrl()))
                        .setStatusCallbackEvent(PARTICIPANT_EVENTS);
            }
            Participant participant = creator.create(client);
            log.info("Added {} leg {} to conference {}", options.label(), participant.getCallSid(), conferenceIdentifier);
            return new AddedParticipant(participant.getCallSid(), participant.getConferenceSid());
        } catch (TwilioException e) {
            throw new TelephonyException("addParticipant", e.getMessage(), e);
        }
    }

    @Override
    public void removeParticipant(String conferenceIdentifier, String callReference) {
        try {
            Participant.deleter(conferenceIdentifier, callReference).delete(client);
        } catch (TwilioException e) {
            throw new TelephonyException("removeParticipant", e.getMessage(), e);
        }
    }

    @Override
    public void holdParticipant(String conferenceIdentifier, String callReference, boolean hold) {
        try {
            Participant.updater(conferenceIdentifier, callReference).setHold(hold).update(client);
        } catch (TwilioException e) {
            throw new TelephonyException("holdParticipant", e.getMessage(), e);
        }
    }

    @Override
    public void muteParticipant(String conferenceIdentifier, String callReference, boolean muted) {
        try {
            Participant.updater(conferenceIdentifier, callReference).setMuted(muted).update(client);
        } catch (TwilioException e) {
            throw new TelephonyException("muteParticipant", e.getMessage(), e);
        }
    }

    @Override
    public void setEndConferenceOnExit(String conferenceIdentifier, String callReference, boolean endConferenceOnExit) {
        try {
            Participant.updater(conferenceIdentifier, callReference)
                    .setEndConferenceOnExit(endConferenceOnExit)
                    .update(client);
        } catch (TwilioException e) {
            throw new TelephonyException("setEndConferenceOnExit", e.getMessage(), e);
        }
    }

    @Override
    public List<ConferenceParticipant> listParticipants(String conferenceIdentifier) {
        try {
            List<ConferenceParticipant> participants = new ArrayList<>();
            for (Participant p : Participant.reader(conferenceIdentifier).read(client)) {
                participants.add(new ConferenceParticipant(
                        p.getCallSid(),
                        p.getConferenceSid(),
                        StringUtils.defaultString(p.getLabel()),
                        Boolean.TRUE.equals(p.getHold()),
                        Boolean.TRUE.equals(p.getMuted()),
                        p.getStatus() == null ? "" : p.getStatus().toString()));
            }
            return participants;
        } catch (TwilioException e) {
            throw new TelephonyException("listParticipants", e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> findConferenceId(String conferenceName) {
        try {
            for (Conference conference : Conference.reader()
                    .setFriendlyName(conferenceName)
                    .setStatus(Conference.Status.IN_PROGRESS)
                    .limit(1)
                    .read(client)) {
                return Optional.of(conference.getSid());
            }
            return Optional.empty();
        } catch (TwilioException e) {
            throw new TelephonyException("findConference", e.getMessage(), e);
        }
    }
}
