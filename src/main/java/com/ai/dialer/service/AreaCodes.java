package com.ai.dialer.service;

import org.apache.commons.lang3.StringUtils;

import java.util.Optional;

/**
 * North American numbering helpers.
 */
public final class AreaCodes {

    private AreaCodes() {
    }

    /**
     * Extracts the 3-digit area code from a NANP number in any formatting. An 11-digit number
     * must carry the leading country code 1; a 10-digit number is taken as national.
     */
    public static Optional<String> extract(String phoneNumber) {
        String digits = StringUtils.getDigits(phoneNumber);
        if (digits.length() == 11 && digits.startsWith("1")) {
            return Optional.of(digits.substring(1, 4));
        }
        if (digits.length() == 10) {
            return Optional.of(digits.substring(0, 3));
        }
        return Optional.empty();
    }
}
