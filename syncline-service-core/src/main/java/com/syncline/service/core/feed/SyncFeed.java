package com.syncline.service.core.feed;

import com.syncline.service.core.model.SyncPayload;

/**
 * A readable stream of versioned rows of one payload shape. The storage adapter owns how each feed is
 * queried; the core only names feeds and composes them.
 */
public record SyncFeed<P extends SyncPayload>(String name, Class<P> payloadType, Scope scope) {

    public enum Scope {
        /** Rows visible to {@link FeedQuery#userId()}. */
        USER,
        /** Rows reachable through one relationship, {@link FeedQuery#relationId()}. */
        RELATION
    }

    @Override
    public String toString() {
        return name;
    }
}
