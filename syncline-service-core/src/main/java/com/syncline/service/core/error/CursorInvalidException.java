package com.syncline.service.core.error;

/**
 * A cursor (ack or stored checkpoint) could not be understood. Clients must reset rather than have the
 * server silently fall back to a full scan.
 */
public class CursorInvalidException extends IllegalArgumentException {

    public CursorInvalidException(String message) {
        super(message);
    }
}
