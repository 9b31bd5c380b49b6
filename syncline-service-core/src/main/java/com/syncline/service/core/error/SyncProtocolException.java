package com.syncline.service.core.error;

import java.util.List;

/** Malformed request content. Carries the individual items that were rejected, if any. */
public class SyncProtocolException extends IllegalArgumentException {
    private final List<RejectedItem> rejected;

    public SyncProtocolException(String message) {
        this(message, List.of());
    }

    public SyncProtocolException(String message, List<RejectedItem> rejected) {
        super(message);
        this.rejected = rejected == null ? List.of() : List.copyOf(rejected);
    }

    public List<RejectedItem> rejected() {
        return rejected;
    }

    public record RejectedItem(String value, String reason) {}
}
