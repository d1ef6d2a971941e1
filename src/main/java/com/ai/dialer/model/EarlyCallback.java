package com.ai.dialer.model;

/**
 * A status notification held until its leg joins the group.
 */
public record EarlyCallback(String callReference, ProviderCallStatus status, AnsweredBy answeredBy) {
}
