package com.ai.dialer.dto;

/**
 * Body of hold and mute requests; {@code enabled=false} reverses the state.
 */
public record ParticipantStateRequest(boolean enabled) {
}
