package com.ai.dialer.config;

import com.twilio.http.TwilioRestClient;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TwilioConfig {

    private static final Logger log = LoggerFactory.getLogger(TwilioConfig.class);

    @Value("${twilio.account-sid:}")
    private String accountSid;

    @Value("${twilio.auth-token:}")
    private String authToken;

    @Bean
    public TwilioRestClient twilioRestClient() {
        if (StringUtils.isAnyBlank(accountSid, authToken)) {
            log.warn("Twilio credentials not set; provider requests will be rejected");
        }
        return new TwilioRestClient.Builder(StringUtils.defaultString(accountSid), StringUtils.defaultString(authToken))
                .build();
    }
}
