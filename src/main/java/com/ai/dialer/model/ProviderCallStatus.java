package com.ai.dialer.model;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Optional;

/**
 * Call status values delivered by the provider's status webhook.
 */
public enum ProviderCallStatus {
    QUEUED("queued"),
    INITIATED("initiated"),
    RINGING("ringing"),
    IN_PROGRESS("in-progress"),
    ANSWERED("answered"),
    COMPLETED("completed"),
    BUSY("busy"),
    NO_ANSWER("no-answer"),
    CANCELED("canceled"),
    FAILED("failed");

    private final String wireValue;

    ProviderCallStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    /** The call is over on the provider side. */
    public boolean isEnded() {
        return this == COMPLETED || this == BUSY || this == NO_ANSWER || this == CANCELED || this == FAILED;
    }

    public static Optional<ProviderCallStatus> fromProvider(String raw) {
        if (StringUtils.isBlank(raw)) {
            return Optional.empty();
        }
        String value = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ProviderCallStatus status : values()) {
            if (status.wireValue.equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
