package com.syncline.service.core.model;

import com.syncline.service.core.model.SyncPayloads.SyncAlbumDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncAlbumToAssetDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncAlbumToAssetV1;
import com.syncline.service.core.model.SyncPayloads.SyncAlbumUserDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncAlbumUserV1;
import com.syncline.service.core.model.SyncPayloads.SyncAlbumV1;
import com.syncline.service.core.model.SyncPayloads.SyncAssetDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncAssetExifV1;
import com.syncline.service.core.model.SyncPayloads.SyncAssetFaceDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncAssetFaceV1;
import com.syncline.service.core.model.SyncPayloads.SyncAssetMetadataDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncAssetMetadataV1;
import com.syncline.service.core.model.SyncPayloads.SyncAssetV1;
import com.syncline.service.core.model.SyncPayloads.SyncAuthUserV1;
import com.syncline.service.core.model.SyncPayloads.SyncEmptyV1;
import com.syncline.service.core.model.SyncPayloads.SyncMemoryAssetDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncMemoryAssetV1;
import com.syncline.service.core.model.SyncPayloads.SyncMemoryDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncMemoryV1;
import com.syncline.service.core.model.SyncPayloads.SyncPartnerDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncPartnerV1;
import com.syncline.service.core.model.SyncPayloads.SyncPersonDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncPersonV1;
import com.syncline.service.core.model.SyncPayloads.SyncStackDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncStackV1;
import com.syncline.service.core.model.SyncPayloads.SyncUserDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncUserMetadataDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncUserMetadataV1;
import com.syncline.service.core.model.SyncPayloads.SyncUserV1;
import java.util.Arrays;
import java.util.Optional;

/** Wire type of a stream line. Each constant fixes the payload variant it carries. */
public enum SyncEntityType {
    AuthUserV1(Role.UPSERT, SyncAuthUserV1.class),

    UserV1(Role.UPSERT, SyncUserV1.class),
    UserDeleteV1(Role.DELETE, SyncUserDeleteV1.class),

    AssetV1(Role.UPSERT, SyncAssetV1.class),
    AssetDeleteV1(Role.DELETE, SyncAssetDeleteV1.class),
    AssetExifV1(Role.UPSERT, SyncAssetExifV1.class),
    AssetMetadataV1(Role.UPSERT, SyncAssetMetadataV1.class),
    AssetMetadataDeleteV1(Role.DELETE, SyncAssetMetadataDeleteV1.class),

    PartnerV1(Role.UPSERT, SyncPartnerV1.class),
    PartnerDeleteV1(Role.DELETE, SyncPartnerDeleteV1.class),

    PartnerAssetV1(Role.UPSERT, SyncAssetV1.class),
    PartnerAssetBackfillV1(Role.BACKFILL, SyncAssetV1.class),
    PartnerAssetDeleteV1(Role.DELETE, SyncAssetDeleteV1.class),
    PartnerAssetExifV1(Role.UPSERT, SyncAssetExifV1.class),
    PartnerAssetExifBackfillV1(Role.BACKFILL, SyncAssetExifV1.class),
    PartnerStackV1(Role.UPSERT, SyncStackV1.class),
    PartnerStackBackfillV1(Role.BACKFILL, SyncStackV1.class),
    PartnerStackDeleteV1(Role.DELETE, SyncStackDeleteV1.class),

    AlbumV1(Role.UPSERT, SyncAlbumV1.class),
    AlbumDeleteV1(Role.DELETE, SyncAlbumDeleteV1.class),

    AlbumUserV1(Role.UPSERT, SyncAlbumUserV1.class),
    AlbumUserBackfillV1(Role.BACKFILL, SyncAlbumUserV1.class),
    AlbumUserDeleteV1(Role.DELETE, SyncAlbumUserDeleteV1.class),

    AlbumAssetCreateV1(Role.UPSERT, SyncAssetV1.class),
    AlbumAssetUpdateV1(Role.UPSERT, SyncAssetV1.class),
    AlbumAssetBackfillV1(Role.BACKFILL, SyncAssetV1.class),
    AlbumAssetExifCreateV1(Role.UPSERT, SyncAssetExifV1.class),
    AlbumAssetExifUpdateV1(Role.UPSERT, SyncAssetExifV1.class),
    AlbumAssetExifBackfillV1(Role.BACKFILL, SyncAssetExifV1.class),

    AlbumToAssetV1(Role.UPSERT, SyncAlbumToAssetV1.class),
    AlbumToAssetBackfillV1(Role.BACKFILL, SyncAlbumToAssetV1.class),
    AlbumToAssetDeleteV1(Role.DELETE, SyncAlbumToAssetDeleteV1.class),

    MemoryV1(Role.UPSERT, SyncMemoryV1.class),
    MemoryDeleteV1(Role.DELETE, SyncMemoryDeleteV1.class),

    MemoryToAssetV1(Role.UPSERT, SyncMemoryAssetV1.class),
    MemoryToAssetDeleteV1(Role.DELETE, SyncMemoryAssetDeleteV1.class),

    StackV1(Role.UPSERT, SyncStackV1.class),
    StackDeleteV1(Role.DELETE, SyncStackDeleteV1.class),

    PersonV1(Role.UPSERT, SyncPersonV1.class),
    PersonDeleteV1(Role.DELETE, SyncPersonDeleteV1.class),

    AssetFaceV1(Role.UPSERT, SyncAssetFaceV1.class),
    AssetFaceDeleteV1(Role.DELETE, SyncAssetFaceDeleteV1.class),

    UserMetadataV1(Role.UPSERT, SyncUserMetadataV1.class),
    UserMetadataDeleteV1(Role.DELETE, SyncUserMetadataDeleteV1.class),

    SyncAckV1(Role.CONTROL, SyncEmptyV1.class),
    SyncResetV1(Role.CONTROL, SyncEmptyV1.class),
    SyncCompleteV1(Role.CONTROL, SyncEmptyV1.class);

    public enum Role {
        UPSERT,
        DELETE,
        BACKFILL,
        CONTROL
    }

    private final Role role;
    private final Class<? extends SyncPayload> payloadType;

    SyncEntityType(Role role, Class<? extends SyncPayload> payloadType) {
        this.role = role;
        this.payloadType = payloadType;
    }

    public Role role() {
        return role;
    }

    public Class<? extends SyncPayload> payloadType() {
        return payloadType;
    }

    /**
     * Whether a client may submit an ack for this type. {@link #SyncAckV1} is only a carrier line; its
     * ack always names the backfill type it completes.
     */
    public boolean isAckable() {
        return this != SyncAckV1;
    }

    public static Optional<SyncEntityType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(t -> t.name().equals(name)).findFirst();
    }
}
