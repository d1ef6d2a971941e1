package com.ai.dialer.model;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Optional;

/**
 * Answering-machine detection result reported by the provider.
 */
public enum AnsweredBy {
    HUMAN,
    /** Detection could not decide; treated like a human pickup. */
    UNKNOWN,
    MACHINE;

    public boolean canWin() {
        return this != MACHINE;
    }

    /**
     * Maps provider values such as {@code human}, {@code unknown}, {@code machine_start},
     * {@code machine_end_beep} or {@code fax}. Blank input means no classification yet.
     */
    public static Optional<AnsweredBy> fromProvider(String raw) {
        if (StringUtils.isBlank(raw)) {
            return Optional.empty();
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (value.equals("human")) {
            return Optional.of(HUMAN);
        }
        if (value.startsWith("machine") || value.equals("fax")) {
            return Optional.of(MACHINE);
        }
        return Optional.of(UNKNOWN);
    }
}
