package com.syncline.service.core.error;

import com.syncline.service.core.model.SyncEntityType;
import java.time.Instant;

/** A checkpoint predates the tombstone retention horizon, so deletions may already have been purged. */
public class CursorTooOldException extends RuntimeException {
    private final SyncEntityType type;
    private final Instant horizon;

    public CursorTooOldException(SyncEntityType type, Instant cursorTime, Instant horizon) {
        super("Cursor for " + type + " at " + cursorTime + " is older than the tombstone horizon " + horizon);
        this.type = type;
        this.horizon = horizon;
    }

    public SyncEntityType type() {
        return type;
    }

    public Instant horizon() {
        return horizon;
    }
}
