package com.ai.dialer.exception;

/**
 * No in-progress conference carries the given name. Usually the conference has not
 * started yet or has already ended.
 */
public class ConferenceNotFoundException extends NotFoundException {

    public ConferenceNotFoundException(String conferenceName) {
        super("Conference \"" + conferenceName + "\" not found or not in progress", conferenceName);
    }
}
