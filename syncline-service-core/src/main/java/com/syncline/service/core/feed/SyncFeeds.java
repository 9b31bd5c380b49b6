package com.syncline.service.core.feed;

import com.syncline.service.core.feed.SyncFeed.Scope;
import com.syncline.service.core.model.SyncPayload;
import com.syncline.service.core.model.SyncPayloads.SyncAlbumToAssetV1;
import com.syncline.service.core.model.SyncPayloads.SyncAlbumUserV1;
import com.syncline.service.core.model.SyncPayloads.SyncAlbumV1;
import com.syncline.service.core.model.SyncPayloads.SyncAssetExifV1;
import com.syncline.service.core.model.SyncPayloads.SyncAssetFaceV1;
import com.syncline.service.core.model.SyncPayloads.SyncAssetMetadataV1;
import com.syncline.service.core.model.SyncPayloads.SyncAssetV1;
import com.syncline.service.core.model.SyncPayloads.SyncAuthUserV1;
import com.syncline.service.core.model.SyncPayloads.SyncMemoryAssetV1;
import com.syncline.service.core.model.SyncPayloads.SyncMemoryV1;
import com.syncline.service.core.model.SyncPayloads.SyncPartnerV1;
import com.syncline.service.core.model.SyncPayloads.SyncPersonV1;
import com.syncline.service.core.model.SyncPayloads.SyncStackV1;
import com.syncline.service.core.model.SyncPayloads.SyncUserMetadataV1;
import com.syncline.service.core.model.SyncPayloads.SyncUserV1;
import java.util.List;

/** Catalogue of change feeds. */
public final class SyncFeeds {

    public static final SyncFeed<SyncAuthUserV1> AUTH_USERS = user("auth-users", SyncAuthUserV1.class);
    public static final SyncFeed<SyncUserV1> USERS = user("users", SyncUserV1.class);
    public static final SyncFeed<SyncPartnerV1> PARTNERS = user("partners", SyncPartnerV1.class);

    public static final SyncFeed<SyncAssetV1> ASSETS = user("assets", SyncAssetV1.class);
    public static final SyncFeed<SyncAssetV1> PARTNER_ASSETS = user("partner-assets", SyncAssetV1.class);
    public static final SyncFeed<SyncAssetV1> PARTNER_ASSETS_BACKFILL =
            relation("partner-assets-backfill", SyncAssetV1.class);

    public static final SyncFeed<SyncStackV1> STACKS = user("stacks", SyncStackV1.class);
    public static final SyncFeed<SyncStackV1> PARTNER_STACKS = user("partner-stacks", SyncStackV1.class);
    public static final SyncFeed<SyncStackV1> PARTNER_STACKS_BACKFILL =
            relation("partner-stacks-backfill", SyncStackV1.class);

    public static final SyncFeed<SyncAssetExifV1> ASSET_EXIFS = user("asset-exifs", SyncAssetExifV1.class);
    public static final SyncFeed<SyncAssetExifV1> PARTNER_ASSET_EXIFS =
            user("partner-asset-exifs", SyncAssetExifV1.class);
    public static final SyncFeed<SyncAssetExifV1> PARTNER_ASSET_EXIFS_BACKFILL =
            relation("partner-asset-exifs-backfill", SyncAssetExifV1.class);

    public static final SyncFeed<SyncAlbumV1> ALBUMS = user("albums", SyncAlbumV1.class);
    public static final SyncFeed<SyncAlbumUserV1> ALBUM_USERS = user("album-users", SyncAlbumUserV1.class);
    public static final SyncFeed<SyncAlbumUserV1> ALBUM_USERS_BACKFILL =
            relation("album-users-backfill", SyncAlbumUserV1.class);
    public static final SyncFeed<SyncAlbumToAssetV1> ALBUM_TO_ASSETS =
            user("album-to-assets", SyncAlbumToAssetV1.class);
    public static final SyncFeed<SyncAlbumToAssetV1> ALBUM_TO_ASSETS_BACKFILL =
            relation("album-to-assets-backfill", SyncAlbumToAssetV1.class);

    /** Assets newly linked into a visible album; token is the album link's. */
    public static final SyncFeed<SyncAssetV1> ALBUM_ASSET_CREATES = user("album-asset-creates", SyncAssetV1.class);
    /** Assets updated after being linked; the ceiling bounds the album link token. */
    public static final SyncFeed<SyncAssetV1> ALBUM_ASSET_UPDATES = user("album-asset-updates", SyncAssetV1.class);

    public static final SyncFeed<SyncAssetV1> ALBUM_ASSETS_BACKFILL =
            relation("album-assets-backfill", SyncAssetV1.class);
    public static final SyncFeed<SyncAssetExifV1> ALBUM_ASSET_EXIF_CREATES =
            user("album-asset-exif-creates", SyncAssetExifV1.class);
    public static final SyncFeed<SyncAssetExifV1> ALBUM_ASSET_EXIF_UPDATES =
            user("album-asset-exif-updates", SyncAssetExifV1.class);
    public static final SyncFeed<SyncAssetExifV1> ALBUM_ASSET_EXIFS_BACKFILL =
            relation("album-asset-exifs-backfill", SyncAssetExifV1.class);

    public static final SyncFeed<SyncMemoryV1> MEMORIES = user("memories", SyncMemoryV1.class);
    public static final SyncFeed<SyncMemoryAssetV1> MEMORY_TO_ASSETS =
            user("memory-to-assets", SyncMemoryAssetV1.class);
    public static final SyncFeed<SyncPersonV1> PEOPLE = user("people", SyncPersonV1.class);
    public static final SyncFeed<SyncAssetFaceV1> ASSET_FACES = user("asset-faces", SyncAssetFaceV1.class);
    public static final SyncFeed<SyncUserMetadataV1> USER_METADATA =
            user("user-metadata", SyncUserMetadataV1.class);
    public static final SyncFeed<SyncAssetMetadataV1> ASSET_METADATA =
            user("asset-metadata", SyncAssetMetadataV1.class);

    public static final List<SyncFeed<?>> ALL = List.of(
            AUTH_USERS,
            USERS,
            PARTNERS,
            ASSETS,
            PARTNER_ASSETS,
            PARTNER_ASSETS_BACKFILL,
            STACKS,
            PARTNER_STACKS,
            PARTNER_STACKS_BACKFILL,
            ASSET_EXIFS,
            PARTNER_ASSET_EXIFS,
            PARTNER_ASSET_EXIFS_BACKFILL,
            ALBUMS,
            ALBUM_USERS,
            ALBUM_USERS_BACKFILL,
            ALBUM_TO_ASSETS,
            ALBUM_TO_ASSETS_BACKFILL,
            ALBUM_ASSET_CREATES,
            ALBUM_ASSET_UPDATES,
            ALBUM_ASSETS_BACKFILL,
            ALBUM_ASSET_EXIF_CREATES,
            ALBUM_ASSET_EXIF_UPDATES,
            ALBUM_ASSET_EXIFS_BACKFILL,
            MEMORIES,
            MEMORY_TO_ASSETS,
            PEOPLE,
            ASSET_FACES,
            USER_METADATA,
            ASSET_METADATA);

    private SyncFeeds() {}

    private static <P extends SyncPayload> SyncFeed<P> user(String name, Class<P> type) {
        return new SyncFeed<>(name, type, Scope.USER);
    }

    private static <P extends SyncPayload> SyncFeed<P> relation(String name, Class<P> type) {
        return new SyncFeed<>(name, type, Scope.RELATION);
    }
}
