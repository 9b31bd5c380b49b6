package com.syncline.service.core.tombstone;

/**
 * Deletable entity kinds. Composite keys use the entity id for the first part and the extra id for the
 * second (album/user, album/asset, memory/asset, user/key, asset/key, sharedBy/sharedWith).
 */
public enum TombstoneKind {
    USER,
    PARTNER,
    ASSET,
    ALBUM,
    ALBUM_USER,
    ALBUM_ASSET,
    MEMORY,
    MEMORY_ASSET,
    STACK,
    PERSON,
    ASSET_FACE,
    USER_METADATA,
    ASSET_METADATA
}
