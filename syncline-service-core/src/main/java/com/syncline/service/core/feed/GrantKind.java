package com.syncline.service.core.feed;

/** Relationship whose creation makes previously invisible rows visible to a user. */
public enum GrantKind {
    /** Another user started sharing their library with the session user. */
    PARTNER,
    /** The session user was added to someone else's album. */
    ALBUM_MEMBERSHIP
}
