package com.syncline.service.core.model;

import com.syncline.service.core.model.SyncPayloads.SyncEmptyV1;

/** One NDJSON line of a sync stream. */
public record SyncStreamLine(SyncEntityType type, SyncPayload data, String ack) {

    public SyncStreamLine {
        if (type == null || data == null) {
            throw new IllegalArgumentException("Stream line requires type and data");
        }
        if (!type.payloadType().isInstance(data)) {
            throw new IllegalArgumentException(
                    type + " carries " + type.payloadType().getSimpleName() + ", not " + data.getClass().getSimpleName());
        }
    }

    public static SyncStreamLine of(SyncEntityType type, SyncPayload data, SyncAck ack) {
        return new SyncStreamLine(type, data, ack.encode());
    }

    public static SyncStreamLine reset() {
        return new SyncStreamLine(
                SyncEntityType.SyncResetV1,
                SyncEmptyV1.INSTANCE,
                new SyncAck(SyncEntityType.SyncResetV1, SyncAck.RESET, null).encode());
    }

    public static SyncStreamLine complete(VersionToken nowId) {
        return of(SyncEntityType.SyncCompleteV1, SyncEmptyV1.INSTANCE, SyncAck.of(SyncEntityType.SyncCompleteV1, nowId));
    }
}
