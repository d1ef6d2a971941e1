package com.ai.dialer.exception;

public class GroupNotFoundException extends NotFoundException {

    public GroupNotFoundException(String groupId) {
        super("Parallel dial group not found: " + groupId, groupId);
    }
}
