package com.ai.dialer.exception;

public class InvalidDialRequestException extends DialerException {

    public InvalidDialRequestException(String message) {
        super(message);
    }
}
