package com.syncline.service.core.feed;

import com.syncline.service.core.model.SyncPayload;
import com.syncline.service.core.model.VersionToken;
import java.util.List;
import java.util.UUID;

/** Read side of the syncable entities. Implementations must return rows ordered by ascending token. */
public interface SyncFeedRepository {

    <P extends SyncPayload> List<SyncRow<P>> read(SyncFeed<P> feed, FeedQuery query);

    /**
     * Relationships granted to {@code userId} with a create token at or after {@code fromCreateId} (all when
     * null), ordered by create token.
     */
    List<RelationshipGrant> grantsSince(GrantKind kind, UUID userId, VersionToken fromCreateId);
}
