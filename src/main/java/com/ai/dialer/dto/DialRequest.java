package com.ai.dialer.dto;

import com.ai.dialer.model.NumberPool;
import jakarta.validation.constraints.NotBlank;

/**
 * Single outbound call. The agent's own phone is called first and bridged to {@code to}.
 *
 * @param callerIdNumber manual caller ID; overrides local presence
 */
public record DialRequest(@NotBlank String to,
                          @NotBlank String agentNumber,
                          @NotBlank String holderId,
                          String callerIdNumber,
                          Boolean localPresence,
                          NumberPool numberPool,
                          String statusCallbackUrl) {

    public boolean localPresenceEnabled() {
        return localPresence == null || localPresence;
    }
}
