package com.syncline.service.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/** Wire shapes of the sync protocol, one record per payload variant. */
public final class SyncPayloads {

    private SyncPayloads() {}

    public record SyncUserV1(
            UUID id,
            String name,
            String email,
            String avatarColor,
            Instant deletedAt,
            boolean hasProfileImage,
            Instant profileChangedAt)
            implements SyncPayload {}

    public record SyncAuthUserV1(
            UUID id,
            String name,
            String email,
            String avatarColor,
            Instant deletedAt,
            boolean hasProfileImage,
            Instant profileChangedAt,
            boolean isAdmin,
            String pinCode,
            String oauthId,
            String storageLabel,
            Long quotaSizeInBytes,
            long quotaUsageInBytes)
            implements SyncPayload {}

    public record SyncUserDeleteV1(UUID userId) implements SyncPayload {}

    public record SyncPartnerV1(UUID sharedById, UUID sharedWithId, boolean inTimeline) implements SyncPayload {}

    public record SyncPartnerDeleteV1(UUID sharedById, UUID sharedWithId) implements SyncPayload {}

    public record SyncAssetV1(
            UUID id,
            UUID ownerId,
            String originalFileName,
            String thumbhash,
            String checksum,
            Instant fileCreatedAt,
            Instant fileModifiedAt,
            Instant localDateTime,
            String duration,
            String type,
            Instant deletedAt,
            boolean isFavorite,
            String visibility,
            UUID livePhotoVideoId,
            UUID stackId,
            UUID libraryId,
            Integer width,
            Integer height,
            boolean isEdited)
            implements SyncPayload {}

    public record SyncAssetDeleteV1(UUID assetId) implements SyncPayload {}

    public record SyncAssetExifV1(
            UUID assetId,
            String description,
            Integer exifImageWidth,
            Integer exifImageHeight,
            Long fileSizeInByte,
            String orientation,
            Instant dateTimeOriginal,
            Instant modifyDate,
            String timeZone,
            Double latitude,
            Double longitude,
            String projectionType,
            String city,
            String state,
            String country,
            String make,
            String model,
            String lensModel,
            Double fNumber,
            Double focalLength,
            Integer iso,
            String exposureTime,
            String profileDescription,
            Integer rating,
            Double fps)
            implements SyncPayload {}

    public record SyncAssetMetadataV1(UUID assetId, String key, JsonNode value) implements SyncPayload {}

    public record SyncAssetMetadataDeleteV1(UUID assetId, String key) implements SyncPayload {}

    public record SyncAlbumV1(
            UUID id,
            UUID ownerId,
            String name,
            String description,
            Instant createdAt,
            Instant updatedAt,
            UUID thumbnailAssetId,
            boolean isActivityEnabled,
            String order)
            implements SyncPayload {}

    public record SyncAlbumDeleteV1(UUID albumId) implements SyncPayload {}

    public record SyncAlbumUserV1(UUID albumId, UUID userId, String role) implements SyncPayload {}

    public record SyncAlbumUserDeleteV1(UUID albumId, UUID userId) implements SyncPayload {}

    public record SyncAlbumToAssetV1(UUID albumId, UUID assetId) implements SyncPayload {}

    public record SyncAlbumToAssetDeleteV1(UUID albumId, UUID assetId) implements SyncPayload {}

    public record SyncMemoryV1(
            UUID id,
            Instant createdAt,
            Instant updatedAt,
            Instant deletedAt,
            UUID ownerId,
            String type,
            JsonNode data,
            boolean isSaved,
            Instant memoryAt,
            Instant seenAt,
            Instant showAt,
            Instant hideAt)
            implements SyncPayload {}

    public record SyncMemoryDeleteV1(UUID memoryId) implements SyncPayload {}

    public record SyncMemoryAssetV1(UUID memoryId, UUID assetId) implements SyncPayload {}

    public record SyncMemoryAssetDeleteV1(UUID memoryId, UUID assetId) implements SyncPayload {}

    public record SyncStackV1(UUID id, Instant createdAt, Instant updatedAt, UUID primaryAssetId, UUID ownerId)
            implements SyncPayload {}

    public record SyncStackDeleteV1(UUID stackId) implements SyncPayload {}

    public record SyncPersonV1(
            UUID id,
            Instant createdAt,
            Instant updatedAt,
            UUID ownerId,
            String name,
            LocalDate birthDate,
            boolean isHidden,
            boolean isFavorite,
            String color,
            UUID faceAssetId)
            implements SyncPayload {}

    public record SyncPersonDeleteV1(UUID personId) implements SyncPayload {}

    public record SyncAssetFaceV1(
            UUID id,
            UUID assetId,
            UUID personId,
            int imageWidth,
            int imageHeight,
            int boundingBoxX1,
            int boundingBoxY1,
            int boundingBoxX2,
            int boundingBoxY2,
            String sourceType)
            implements SyncPayload {}

    public record SyncAssetFaceDeleteV1(UUID assetFaceId) implements SyncPayload {}

    public record SyncUserMetadataV1(UUID userId, String key, JsonNode value) implements SyncPayload {}

    public record SyncUserMetadataDeleteV1(UUID userId, String key) implements SyncPayload {}

    /** Body of the control lines (ack, reset, complete); serialises as an empty object. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SyncEmptyV1() implements SyncPayload {
        public static final SyncEmptyV1 INSTANCE = new SyncEmptyV1();
    }
}
