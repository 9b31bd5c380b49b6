package com.syncline.service.core.stream;

public enum SyncStreamOutcome {
    /** Every requested group was drained and {@code SyncCompleteV1} was sent. */
    COMPLETE,
    /** The client was told to reset; nothing else was sent after the signal. */
    RESET
}
