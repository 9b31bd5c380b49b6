package com.syncline.service.core.legacy;

import java.time.Instant;
import java.util.UUID;

/** Asset as returned by the legacy sync endpoints. */
public record AssetResponse(
        UUID id,
        UUID ownerId,
        String type,
        String originalFileName,
        String checksum,
        String thumbhash,
        Instant fileCreatedAt,
        Instant fileModifiedAt,
        Instant localDateTime,
        Instant updatedAt,
        boolean isFavorite,
        String visibility,
        boolean isTrashed,
        Instant deletedAt,
        String duration,
        UUID livePhotoVideoId,
        UUID stackId,
        UUID libraryId,
        Integer width,
        Integer height) {

    public static final String VISIBILITY_TIMELINE = "timeline";

    /** Partners' assets carry no stack: stacks are private to their owner. */
    public AssetResponse withoutStack() {
        return new AssetResponse(id, ownerId, type, originalFileName, checksum, thumbhash, fileCreatedAt,
                fileModifiedAt, localDateTime, updatedAt, isFavorite, visibility, isTrashed, deletedAt, duration,
                livePhotoVideoId, null, libraryId, width, height);
    }
}
