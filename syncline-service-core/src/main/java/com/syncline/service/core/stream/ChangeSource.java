package com.syncline.service.core.stream;

import com.syncline.service.core.feed.SyncFeed;
import com.syncline.service.core.model.SyncEntityType;
import com.syncline.service.core.model.SyncPayload;
import com.syncline.service.core.model.VersionToken;
import com.syncline.service.core.tombstone.Tombstone;
import com.syncline.service.core.tombstone.TombstoneKind;
import com.syncline.service.core.tombstone.TombstoneScope;
import java.util.function.Function;

/** One input of a {@link ChangeEmitter} drain, emitted under its own wire type and checkpoint. */
public sealed interface ChangeSource permits ChangeSource.Rows, ChangeSource.Deletes {

    SyncEntityType type();

    static <P extends SyncPayload> Rows<P> rows(SyncEntityType type, SyncFeed<P> feed) {
        return new Rows<>(type, feed, null);
    }

    static <P extends SyncPayload> Rows<P> rows(SyncEntityType type, SyncFeed<P> feed, VersionToken ceiling) {
        return new Rows<>(type, feed, ceiling);
    }

    static Deletes deletes(
            SyncEntityType type,
            TombstoneKind kind,
            TombstoneScope scope,
            Function<Tombstone, ? extends SyncPayload> mapper) {
        return new Deletes(type, kind, scope, mapper);
    }

    /** Current rows of a feed (creates and updates). */
    record Rows<P extends SyncPayload>(SyncEntityType type, SyncFeed<P> feed, VersionToken ceiling)
            implements ChangeSource {}

    /** Tombstones of one kind, projected to the delete payload. */
    record Deletes(
            SyncEntityType type,
            TombstoneKind kind,
            TombstoneScope scope,
            Function<Tombstone, ? extends SyncPayload> mapper)
            implements ChangeSource {}
}
