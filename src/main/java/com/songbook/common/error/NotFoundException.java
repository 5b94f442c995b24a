package com.songbook.common.error;

public class NotFoundException extends GovernanceException {

    public NotFoundException(String reason) {
        super(reason);
    }
}
