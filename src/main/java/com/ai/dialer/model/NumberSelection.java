package com.ai.dialer.model;

/**
 * Outcome of local-presence selection.
 */
public record NumberSelection(String phoneNumber,
                              String areaCode,
                              boolean localMatch,
                              boolean proximityMatch,
                              Double distanceMiles,
                              boolean primary,
                              String customerAreaCode) {
}
