package com.syncline.service.core.stream;

import static com.syncline.service.core.stream.ChangeSource.deletes;
import static com.syncline.service.core.stream.ChangeSource.rows;

import com.syncline.service.core.feed.GrantKind;
import com.syncline.service.core.feed.SyncFeed;
import com.syncline.service.core.feed.SyncFeeds;
import com.syncline.service.core.model.SyncEntityType;
import com.syncline.service.core.model.SyncPayloads.SyncAlbumDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncAlbumToAssetDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncAlbumUserDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncAssetDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncAssetFaceDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncAssetMetadataDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncMemoryAssetDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncMemoryDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncPartnerDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncPersonDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncStackDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncUserDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncUserMetadataDeleteV1;
import com.syncline.service.core.model.SyncPayload;
import com.syncline.service.core.model.SyncRequestType;
import com.syncline.service.core.model.VersionToken;
import com.syncline.service.core.tombstone.TombstoneKind;
import com.syncline.service.core.tombstone.TombstoneScope;
import java.io.IOException;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Maps every request group to the sources it drains, in delivery order within the group. */
@Component
public class SyncHandlerCatalog {
    private final ChangeEmitter emitter;
    private final BackfillResolver backfill;
    private final Map<SyncRequestType, SyncTypeHandler> handlers = new EnumMap<>(SyncRequestType.class);

    public SyncHandlerCatalog(ChangeEmitter emitter, BackfillResolver backfill) {
        this.emitter = emitter;
        this.backfill = backfill;
        register();
        for (SyncRequestType type : SyncRequestType.values()) {
            if (!handlers.containsKey(type)) {
                throw new IllegalStateException("No sync handler registered for " + type);
            }
        }
    }

    public SyncTypeHandler handler(SyncRequestType type) {
        return handlers.get(type);
    }

    private void register() {
        handlers.put(SyncRequestType.AuthUsersV1, ctx -> emitter.drain(
                ctx, rows(SyncEntityType.AuthUserV1, SyncFeeds.AUTH_USERS)));
        handlers.put(SyncRequestType.UsersV1, ctx -> emitter.drain(
                ctx,
                deletes(SyncEntityType.UserDeleteV1, TombstoneKind.USER, TombstoneScope.GLOBAL,
                        t -> new SyncUserDeleteV1(t.entityUuid())),
                rows(SyncEntityType.UserV1, SyncFeeds.USERS)));
        handlers.put(SyncRequestType.PartnersV1, ctx -> emitter.drain(
                ctx,
                deletes(SyncEntityType.PartnerDeleteV1, TombstoneKind.PARTNER, TombstoneScope.PARTNER_PAIR,
                        t -> new SyncPartnerDeleteV1(t.entityUuid(), t.extraUuid())),
                rows(SyncEntityType.PartnerV1, SyncFeeds.PARTNERS)));
        handlers.put(SyncRequestType.AssetsV1, ctx -> emitter.drain(
                ctx,
                deletes(SyncEntityType.AssetDeleteV1, TombstoneKind.ASSET, TombstoneScope.OWNER,
                        t -> new SyncAssetDeleteV1(t.entityUuid())),
                rows(SyncEntityType.AssetV1, SyncFeeds.ASSETS)));
        handlers.put(SyncRequestType.StacksV1, ctx -> emitter.drain(
                ctx,
                deletes(SyncEntityType.StackDeleteV1, TombstoneKind.STACK, TombstoneScope.OWNER,
                        t -> new SyncStackDeleteV1(t.entityUuid())),
                rows(SyncEntityType.StackV1, SyncFeeds.STACKS)));
        handlers.put(SyncRequestType.PartnerAssetsV1, ctx -> {
            backfill.resolve(ctx, GrantKind.PARTNER, SyncEntityType.PartnerAssetBackfillV1,
                    SyncEntityType.PartnerAssetV1, SyncFeeds.PARTNER_ASSETS_BACKFILL);
            emitter.drain(
                    ctx,
                    deletes(SyncEntityType.PartnerAssetDeleteV1, TombstoneKind.ASSET, TombstoneScope.PARTNER_OWNED,
                            t -> new SyncAssetDeleteV1(t.entityUuid())),
                    rows(SyncEntityType.PartnerAssetV1, SyncFeeds.PARTNER_ASSETS));
        });
        handlers.put(SyncRequestType.PartnerStacksV1, ctx -> {
            backfill.resolve(ctx, GrantKind.PARTNER, SyncEntityType.PartnerStackBackfillV1,
                    SyncEntityType.PartnerStackV1, SyncFeeds.PARTNER_STACKS_BACKFILL);
            emitter.drain(
                    ctx,
                    deletes(SyncEntityType.PartnerStackDeleteV1, TombstoneKind.STACK, TombstoneScope.PARTNER_OWNED,
                            t -> new SyncStackDeleteV1(t.entityUuid())),
                    rows(SyncEntityType.PartnerStackV1, SyncFeeds.PARTNER_STACKS));
        });
        handlers.put(SyncRequestType.AlbumAssetsV1, ctx -> albumContents(
                ctx,
                SyncEntityType.AlbumAssetBackfillV1,
                SyncEntityType.AlbumAssetCreateV1,
                SyncEntityType.AlbumAssetUpdateV1,
                SyncFeeds.ALBUM_ASSETS_BACKFILL,
                SyncFeeds.ALBUM_ASSET_CREATES,
                SyncFeeds.ALBUM_ASSET_UPDATES));
        handlers.put(SyncRequestType.AlbumsV1, ctx -> emitter.drain(
                ctx,
                deletes(SyncEntityType.AlbumDeleteV1, TombstoneKind.ALBUM, TombstoneScope.OWNER,
                        t -> new SyncAlbumDeleteV1(t.entityUuid())),
                rows(SyncEntityType.AlbumV1, SyncFeeds.ALBUMS)));
        handlers.put(SyncRequestType.AlbumUsersV1, ctx -> {
            backfill.resolve(ctx, GrantKind.ALBUM_MEMBERSHIP, SyncEntityType.AlbumUserBackfillV1,
                    SyncEntityType.AlbumUserV1, SyncFeeds.ALBUM_USERS_BACKFILL);
            emitter.drain(
                    ctx,
                    deletes(SyncEntityType.AlbumUserDeleteV1, TombstoneKind.ALBUM_USER, TombstoneScope.ALBUM_MEMBER,
                            t -> new SyncAlbumUserDeleteV1(t.entityUuid(), t.extraUuid())),
                    rows(SyncEntityType.AlbumUserV1, SyncFeeds.ALBUM_USERS));
        });
        handlers.put(SyncRequestType.AlbumToAssetsV1, ctx -> {
            backfill.resolve(ctx, GrantKind.ALBUM_MEMBERSHIP, SyncEntityType.AlbumToAssetBackfillV1,
                    SyncEntityType.AlbumToAssetV1, SyncFeeds.ALBUM_TO_ASSETS_BACKFILL);
            emitter.drain(
                    ctx,
                    deletes(SyncEntityType.AlbumToAssetDeleteV1, TombstoneKind.ALBUM_ASSET,
                            TombstoneScope.ALBUM_SCOPED, t -> new SyncAlbumToAssetDeleteV1(t.entityUuid(), t.extraUuid())),
                    rows(SyncEntityType.AlbumToAssetV1, SyncFeeds.ALBUM_TO_ASSETS));
        });
        handlers.put(SyncRequestType.AssetExifsV1, ctx -> emitter.drain(
                ctx, rows(SyncEntityType.AssetExifV1, SyncFeeds.ASSET_EXIFS)));
        handlers.put(SyncRequestType.AlbumAssetExifsV1, ctx -> albumContents(
                ctx,
                SyncEntityType.AlbumAssetExifBackfillV1,
                SyncEntityType.AlbumAssetExifCreateV1,
                SyncEntityType.AlbumAssetExifUpdateV1,
                SyncFeeds.ALBUM_ASSET_EXIFS_BACKFILL,
                SyncFeeds.ALBUM_ASSET_EXIF_CREATES,
                SyncFeeds.ALBUM_ASSET_EXIF_UPDATES));
        handlers.put(SyncRequestType.PartnerAssetExifsV1, ctx -> {
            backfill.resolve(ctx, GrantKind.PARTNER, SyncEntityType.PartnerAssetExifBackfillV1,
                    SyncEntityType.PartnerAssetExifV1, SyncFeeds.PARTNER_ASSET_EXIFS_BACKFILL);
            emitter.drain(ctx, rows(SyncEntityType.PartnerAssetExifV1, SyncFeeds.PARTNER_ASSET_EXIFS));
        });
        handlers.put(SyncRequestType.MemoriesV1, ctx -> emitter.drain(
                ctx,
                deletes(SyncEntityType.MemoryDeleteV1, TombstoneKind.MEMORY, TombstoneScope.OWNER,
                        t -> new SyncMemoryDeleteV1(t.entityUuid())),
                rows(SyncEntityType.MemoryV1, SyncFeeds.MEMORIES)));
        handlers.put(SyncRequestType.MemoryToAssetsV1, ctx -> emitter.drain(
                ctx,
                deletes(SyncEntityType.MemoryToAssetDeleteV1, TombstoneKind.MEMORY_ASSET, TombstoneScope.OWNER,
                        t -> new SyncMemoryAssetDeleteV1(t.entityUuid(), t.extraUuid())),
                rows(SyncEntityType.MemoryToAssetV1, SyncFeeds.MEMORY_TO_ASSETS)));
        handlers.put(SyncRequestType.PeopleV1, ctx -> emitter.drain(
                ctx,
                deletes(SyncEntityType.PersonDeleteV1, TombstoneKind.PERSON, TombstoneScope.OWNER,
                        t -> new SyncPersonDeleteV1(t.entityUuid())),
                rows(SyncEntityType.PersonV1, SyncFeeds.PEOPLE)));
        handlers.put(SyncRequestType.AssetFacesV1, ctx -> emitter.drain(
                ctx,
                deletes(SyncEntityType.AssetFaceDeleteV1, TombstoneKind.ASSET_FACE, TombstoneScope.OWNER,
                        t -> new SyncAssetFaceDeleteV1(t.entityUuid())),
                rows(SyncEntityType.AssetFaceV1, SyncFeeds.ASSET_FACES)));
        handlers.put(SyncRequestType.UserMetadataV1, ctx -> emitter.drain(
                ctx,
                deletes(SyncEntityType.UserMetadataDeleteV1, TombstoneKind.USER_METADATA, TombstoneScope.OWNER,
                        t -> new SyncUserMetadataDeleteV1(t.entityUuid(), t.extraId())),
                rows(SyncEntityType.UserMetadataV1, SyncFeeds.USER_METADATA)));
        handlers.put(SyncRequestType.AssetMetadataV1, ctx -> emitter.drain(
                ctx,
                deletes(SyncEntityType.AssetMetadataDeleteV1, TombstoneKind.ASSET_METADATA, TombstoneScope.OWNER,
                        t -> new SyncAssetMetadataDeleteV1(t.entityUuid(), t.extraId())),
                rows(SyncEntityType.AssetMetadataV1, SyncFeeds.ASSET_METADATA)));
    }

    /**
     * Album-visible assets: backfill newly joined albums, then assets updated after being linked (bounded by
     * the create checkpoint so links not yet delivered are skipped), then newly linked assets.
     */
    private <P extends SyncPayload> void albumContents(
            SyncStreamContext ctx,
            SyncEntityType backfillType,
            SyncEntityType createType,
            SyncEntityType updateType,
            SyncFeed<P> backfillFeed,
            SyncFeed<P> createFeed,
            SyncFeed<P> updateFeed)
            throws IOException {
        backfill.resolve(ctx, GrantKind.ALBUM_MEMBERSHIP, backfillType, createType, backfillFeed);
        VersionToken createCheckpoint = ctx.checkpoints().token(createType);
        if (createCheckpoint != null) {
            emitter.drain(ctx, rows(updateType, updateFeed, createCheckpoint));
        }
        emitter.drain(ctx, rows(createType, createFeed));
    }
}
