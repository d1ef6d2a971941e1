package com.ai.dialer.model;

public record AddedParticipant(String callReference, String conferenceIdentifier) {
}
