package com.ai.dialer.controller;

import com.twilio.jwt.accesstoken.AccessToken;
import com.twilio.jwt.accesstoken.VoiceGrant;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Access tokens for the browser softphone, so agents can place and receive calls in the browser.
 */
@RestController
public class TokenController {

    private static final Logger log = LoggerFactory.getLogger(TokenController.class);

    private static final int TOKEN_TTL_SECONDS = 3600;

    @Value("${twilio.account-sid:}")
    private String accountSid;

    @Value("${twilio.api-key-sid:}")
    private String apiKeySid;

    @Value("${twilio.api-key-secret:}")
    private String apiKeySecret;

    @Value("${twilio.twiml-app-sid:}")
    private String twimlAppSid;

    @GetMapping("/token")
    public Map<String, String> token(@RequestParam String identity) {
        VoiceGrant grant = new VoiceGrant();
        grant.setOutgoingApplicationSid(twimlAppSid);
        grant.setIncomingAllow(true);

        AccessToken token = new AccessToken.Builder(accountSid, apiKeySid, apiKeySecret)
                .identity(identity)
                .ttl(TOKEN_TTL_SECONDS)
                .grant(grant)
                .build();
        if (StringUtils.isBlank(twimlAppSid)) {
            log.warn("twilio.twiml-app-sid not set; token for {} cannot place outgoing calls", identity);
        }
        return Map.of("identity", identity, "token", token.toJwt());
    }
}
