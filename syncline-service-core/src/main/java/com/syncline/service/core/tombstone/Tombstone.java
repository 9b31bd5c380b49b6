package com.syncline.service.core.tombstone;

import com.syncline.service.core.model.VersionToken;
import java.time.Instant;
import java.util.UUID;

/** Durable record of a deletion; written once, never mutated, purged after the retention window. */
public record Tombstone(
        VersionToken id, TombstoneKind kind, String entityId, String extraId, UUID scopeOwnerId, Instant deletedAt) {

    public UUID entityUuid() {
        return UUID.fromString(entityId);
    }

    public UUID extraUuid() {
        return extraId == null ? null : UUID.fromString(extraId);
    }
}
