package com.syncline.service.core.tombstone;

import com.syncline.service.core.feed.FeedQuery;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface TombstoneLog {

    /** Called by the owning business service in the same transaction that removes the row. */
    void append(Tombstone tombstone);

    /** Tombstones of {@code kind} visible under {@code scope}, ascending by id, bounded like a feed page. */
    List<Tombstone> read(TombstoneKind kind, TombstoneScope scope, FeedQuery query);

    /** Ids of entities owned by any of {@code scopeOwnerIds} deleted strictly after {@code deletedAfter}. */
    List<String> deletedEntityIds(TombstoneKind kind, Collection<UUID> scopeOwnerIds, Instant deletedAfter);

    /** Removes tombstones deleted before {@code cutoff}; returns the number removed. */
    int purgeDeletedBefore(Instant cutoff);
}
