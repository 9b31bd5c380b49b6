package com.syncline.service.core.tombstone;

/** Visibility predicate applied when reading tombstones for a session user. */
public enum TombstoneScope {
    /** Every user sees it. */
    GLOBAL,
    /** scope owner is the user. Album tombstones are written once per recipient for this scope. */
    OWNER,
    /** scope owner shares their library with the user. */
    PARTNER_OWNED,
    /** user is on either side of the partner pair (entity id or extra id). */
    PARTNER_PAIR,
    /** entity id is an album the user owns or was added to. */
    ALBUM_SCOPED,
    /** as {@link #ALBUM_SCOPED}, or the user is the removed member (extra id). */
    ALBUM_MEMBER
}
