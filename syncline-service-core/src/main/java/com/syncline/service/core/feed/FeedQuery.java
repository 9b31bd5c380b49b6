package com.syncline.service.core.feed;

import com.syncline.service.core.model.VersionToken;
import java.util.UUID;

/**
 * Page request against a feed or the tombstone log.
 *
 * @param userId session user whose visibility applies
 * @param relationId partner or album id for relation-scoped feeds, otherwise null
 * @param after exclusive lower token bound, null to start from the beginning
 * @param ceiling inclusive upper bound on the feed's ceiling column (see storage adapter), or null
 * @param before exclusive upper token bound shared by a whole stream open
 * @param limit maximum rows to return
 */
public record FeedQuery(
        UUID userId,
        UUID relationId,
        VersionToken after,
        VersionToken ceiling,
        VersionToken before,
        int limit) {

    public FeedQuery {
        if (userId == null) {
            throw new IllegalArgumentException("userId is required");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }

    public FeedQuery withAfter(VersionToken next) {
        return new FeedQuery(userId, relationId, next, ceiling, before, limit);
    }
}
