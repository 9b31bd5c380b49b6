package com.syncline.service.core.error;

public class SyncForbiddenException extends RuntimeException {

    public SyncForbiddenException(String message) {
        super(message);
    }
}
