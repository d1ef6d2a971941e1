package com.ai.dialer.service;

import com.ai.dialer.config.DialerProperties;
import com.ai.dialer.dto.DialRequest;
import com.ai.dialer.dto.DialResult;
import com.ai.dialer.exception.CallerIdLockedException;
import com.ai.dialer.exception.TelephonyException;
import com.ai.dialer.model.NumberSelection;
import com.ai.dialer.model.OutboundCall;
import com.ai.dialer.model.ProviderCallStatus;
import com.ai.dialer.model.SelectionMethod;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.UUID;

/**
 * One outbound call from an agent. The agent's phone rings first and is then bridged to the
 * customer, presenting the chosen caller ID.
 */
@Service
public class DialService {

    private static final Logger log = LoggerFactory.getLogger(DialService.class);

    public static final String AGENT_TWIML_PATH = "/v1/calls/dial/agent-twiml";
    public static final String STATUS_CALLBACK_PATH = "/v1/calls/dial/status-callback";

    private final TelephonyGateway telephony;
    private final CallerIdLockService lockService;
    private final LocalPresenceService localPresence;
    private final DialerProperties properties;

    public DialService(TelephonyGateway telephony, CallerIdLockService lockService,
                       LocalPresenceService localPresence, DialerProperties properties) {
        this.telephony = telephony;
        this.lockService = lockService;
        this.localPresence = localPresence;
        this.properties = properties;
    }

    /**
     * @throws CallerIdLockedException when the chosen caller ID is on another live call
     * @throws TelephonyException when the provider rejects the call; the lock is released first
     */
    public DialResult dial(DialRequest request) {
        CallerIdChoice choice = chooseCallerId(request);
        String provisional = "dial_" + UUID.randomUUID();
        if (!lockService.acquire(choice.number(), request.holderId(), provisional)) {
            throw new CallerIdLockedException(choice.number());
        }

        String baseUrl = StringUtils.removeEnd(StringUtils.trimToEmpty(properties.getBaseUrl()), "/");
        String twimlUrl = baseUrl + AGENT_TWIML_PATH
                + "?to=" + URLEncoder.encode(request.to(), StandardCharsets.UTF_8)
                + "&callerId=" + URLEncoder.encode(choice.number(), StandardCharsets.UTF_8);
        String statusCallbackUrl = StringUtils.defaultIfBlank(request.statusCallbackUrl(), baseUrl + STATUS_CALLBACK_PATH);

        String callReference;
        try {
            callReference = telephony.dial(new OutboundCall(request.agentNumber(), choice.number(),
                    twimlUrl, statusCallbackUrl, false));
        } catch (TelephonyException e) {
            lockService.release(provisional);
            log.error("Dial to {} from {} failed: {}", request.to(), choice.number(), e.getMessage());
            throw e;
        }
        lockService.rebind(choice.number(), provisional, callReference);
        log.info("Call {} placed to {} from {} ({})", callReference, request.to(), choice.number(), choice.method());
        return new DialResult(callReference, choice.number(), choice.method());
    }

    public void hangup(String callReference) {
        try {
            telephony.hangup(callReference);
        } finally {
            lockService.release(callReference);
        }
    }

    /** Frees the caller ID once the provider reports the call over. */
    public void handleStatusCallback(String callReference, String providerStatus) {
        Optional<ProviderCallStatus> status = ProviderCallStatus.fromProvider(providerStatus);
        if (status.isEmpty()) {
            log.warn("Ignoring callback for {} with unknown status '{}'", callReference, providerStatus);
            return;
        }
        if (status.get().isEnded() && lockService.release(callReference)) {
            log.info("Call {} ended ({}); caller ID released", callReference, providerStatus);
        }
    }

    private CallerIdChoice chooseCallerId(DialRequest request) {
        if (StringUtils.isNotBlank(request.callerIdNumber())) {
            return new CallerIdChoice(request.callerIdNumber(), SelectionMethod.MANUAL);
        }
        if (request.localPresenceEnabled() && request.numberPool() != null) {
            Optional<NumberSelection> selection = localPresence.selectNumber(request.numberPool(), request.to());
            if (selection.isPresent()) {
                NumberSelection s = selection.get();
                boolean local = s.localMatch() || s.proximityMatch();
                return new CallerIdChoice(s.phoneNumber(), local ? SelectionMethod.LOCAL_PRESENCE : SelectionMethod.PRIMARY_FALLBACK);
            }
        }
        if (StringUtils.isNotBlank(properties.getDefaultNumber())) {
            return new CallerIdChoice(properties.getDefaultNumber(), SelectionMethod.PRIMARY);
        }
        return new CallerIdChoice(request.agentNumber(), SelectionMethod.SYSTEM_DEFAULT);
    }

    private record CallerIdChoice(String number, SelectionMethod method) {
    }
}
