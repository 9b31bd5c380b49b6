package com.syncline.service.core.model;

import static com.syncline.service.core.model.SyncEntityType.*;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Entity groups a client can request on stream open. Declaration order is the delivery order of a
 * stream; each group expands to the wire types it can produce.
 */
public enum SyncRequestType {
    AuthUsersV1(AuthUserV1),
    UsersV1(UserV1, UserDeleteV1),
    PartnersV1(PartnerV1, PartnerDeleteV1),
    AssetsV1(AssetV1, AssetDeleteV1),
    StacksV1(StackV1, StackDeleteV1),
    PartnerAssetsV1(PartnerAssetV1, PartnerAssetBackfillV1, PartnerAssetDeleteV1),
    PartnerStacksV1(PartnerStackV1, PartnerStackBackfillV1, PartnerStackDeleteV1),
    AlbumAssetsV1(AlbumAssetCreateV1, AlbumAssetUpdateV1, AlbumAssetBackfillV1),
    AlbumsV1(AlbumV1, AlbumDeleteV1),
    AlbumUsersV1(AlbumUserV1, AlbumUserBackfillV1, AlbumUserDeleteV1),
    AlbumToAssetsV1(AlbumToAssetV1, AlbumToAssetBackfillV1, AlbumToAssetDeleteV1),
    AssetExifsV1(AssetExifV1),
    AlbumAssetExifsV1(AlbumAssetExifCreateV1, AlbumAssetExifUpdateV1, AlbumAssetExifBackfillV1),
    PartnerAssetExifsV1(PartnerAssetExifV1, PartnerAssetExifBackfillV1),
    MemoriesV1(MemoryV1, MemoryDeleteV1),
    MemoryToAssetsV1(MemoryToAssetV1, MemoryToAssetDeleteV1),
    PeopleV1(PersonV1, PersonDeleteV1),
    AssetFacesV1(AssetFaceV1, AssetFaceDeleteV1),
    UserMetadataV1(SyncEntityType.UserMetadataV1, UserMetadataDeleteV1),
    AssetMetadataV1(SyncEntityType.AssetMetadataV1, AssetMetadataDeleteV1);

    private final List<SyncEntityType> entityTypes;

    SyncRequestType(SyncEntityType... entityTypes) {
        this.entityTypes = List.of(entityTypes);
    }

    public List<SyncEntityType> entityTypes() {
        return entityTypes;
    }

    public static Optional<SyncRequestType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(t -> t.name().equals(name)).findFirst();
    }
}
