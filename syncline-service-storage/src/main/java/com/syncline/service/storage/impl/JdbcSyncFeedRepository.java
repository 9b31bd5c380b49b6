package com.syncline.service.storage.impl;

import static com.syncline.service.storage.impl.SyncFeedSql.ALBUM_COLUMNS;
import static com.syncline.service.storage.impl.SyncFeedSql.ASSET_COLUMNS;
import static com.syncline.service.storage.impl.SyncFeedSql.AUTH_USER_COLUMNS;
import static com.syncline.service.storage.impl.SyncFeedSql.EXIF_COLUMNS;
import static com.syncline.service.storage.impl.SyncFeedSql.FACE_COLUMNS;
import static com.syncline.service.storage.impl.SyncFeedSql.MEMORY_COLUMNS;
import static com.syncline.service.storage.impl.SyncFeedSql.PARTNER_OWNERS;
import static com.syncline.service.storage.impl.SyncFeedSql.PERSON_COLUMNS;
import static com.syncline.service.storage.impl.SyncFeedSql.STACK_COLUMNS;
import static com.syncline.service.storage.impl.SyncFeedSql.USER_COLUMNS;
import static com.syncline.service.storage.impl.SyncFeedSql.VISIBLE_ALBUMS;
import static com.syncline.service.storage.impl.SyncFeedSql.ceiled;
import static com.syncline.service.storage.impl.SyncFeedSql.of;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncline.service.core.feed.FeedQuery;
import com.syncline.service.core.feed.GrantKind;
import com.syncline.service.core.feed.RelationshipGrant;
import com.syncline.service.core.feed.SyncFeed;
import com.syncline.service.core.feed.SyncFeedRepository;
import com.syncline.service.core.feed.SyncFeeds;
import com.syncline.service.core.feed.SyncRow;
import com.syncline.service.core.model.SyncPayload;
import com.syncline.service.core.model.VersionToken;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcSyncFeedRepository implements SyncFeedRepository {

    private static final String PARTNER_GRANTS =
            """
        select p.shared_by_id as relation_id, p.create_id
          from partner p
         where p.shared_with_id = :user_id
        """;

    private static final String ALBUM_GRANTS =
            """
        select au.album_id as relation_id, au.create_id
          from album_user au
         where au.user_id = :user_id
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final Map<String, SyncFeedSql<?>> feeds = new HashMap<>();

    public JdbcSyncFeedRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        register(objectMapper);
        for (SyncFeed<?> feed : SyncFeeds.ALL) {
            if (!feeds.containsKey(feed.name())) {
                throw new IllegalStateException("No query registered for feed " + feed.name());
            }
        }
    }

    @Override
    public <P extends SyncPayload> List<SyncRow<P>> read(SyncFeed<P> feed, FeedQuery query) {
        SyncFeedSql<?> sql = feeds.get(feed.name());
        if (sql == null) {
            throw new IllegalArgumentException("Unknown feed " + feed.name());
        }
        if (feed.scope() == SyncFeed.Scope.RELATION && query.relationId() == null) {
            throw new IllegalArgumentException("Feed " + feed.name() + " requires a relation id");
        }
        MapSqlParameterSource p = new MapSqlParameterSource()
                .addValue("user_id", query.userId())
                .addValue("relation_id", query.relationId())
                .addValue("before", query.before().value())
                .addValue("after", JdbcRows.value(query.after()))
                .addValue("ceiling", JdbcRows.value(query.ceiling()))
                .addValue("limit", query.limit());
        RowMapper<?> mapper = sql.mapper();
        return jdbc.query(
                sql.render(query.after() != null, query.ceiling() != null),
                p,
                (rs, rowNum) -> new SyncRow<>(
                        JdbcRows.token(rs, "sync_token"), feed.payloadType().cast(mapper.mapRow(rs, rowNum))));
    }

    @Override
    public List<RelationshipGrant> grantsSince(GrantKind kind, UUID userId, VersionToken fromCreateId) {
        String base = kind == GrantKind.PARTNER ? PARTNER_GRANTS : ALBUM_GRANTS;
        String alias = kind == GrantKind.PARTNER ? "p" : "au";
        StringBuilder sql = new StringBuilder(base);
        MapSqlParameterSource p = new MapSqlParameterSource("user_id", userId);
        if (fromCreateId != null) {
            sql.append("   and ").append(alias).append(".create_id >= :from_create_id\n");
            p.addValue("from_create_id", fromCreateId.value());
        }
        sql.append(" order by ").append(alias).append(".create_id");
        return jdbc.query(
                sql.toString(),
                p,
                (rs, rowNum) -> new RelationshipGrant(
                        kind, JdbcRows.uuid(rs, "relation_id"), JdbcRows.token(rs, "create_id")));
    }

    private void register(ObjectMapper objectMapper) {
        put(SyncFeeds.AUTH_USERS, of(AUTH_USER_COLUMNS, "users u", "u.id = :user_id", "u.update_id", SyncRowMappers.AUTH_USER));
        put(SyncFeeds.USERS, of(USER_COLUMNS, "users u", "1 = 1", "u.update_id", SyncRowMappers.USER));
        put(SyncFeeds.PARTNERS, of(
                "p.shared_by_id, p.shared_with_id, p.in_timeline",
                "partner p",
                "(p.shared_by_id = :user_id or p.shared_with_id = :user_id)",
                "p.update_id",
                SyncRowMappers.PARTNER));

        put(SyncFeeds.ASSETS, of(ASSET_COLUMNS, "asset a", "a.owner_id = :user_id", "a.update_id", SyncRowMappers.ASSET));
        put(SyncFeeds.PARTNER_ASSETS, of(
                ASSET_COLUMNS, "asset a", "a.owner_id in " + PARTNER_OWNERS, "a.update_id", SyncRowMappers.ASSET));
        put(SyncFeeds.PARTNER_ASSETS_BACKFILL, ceiled(
                ASSET_COLUMNS, "asset a", "a.owner_id = :relation_id", "a.update_id", SyncRowMappers.ASSET));

        put(SyncFeeds.STACKS, of(STACK_COLUMNS, "stack s", "s.owner_id = :user_id", "s.update_id", SyncRowMappers.STACK));
        put(SyncFeeds.PARTNER_STACKS, of(
                STACK_COLUMNS, "stack s", "s.owner_id in " + PARTNER_OWNERS, "s.update_id", SyncRowMappers.STACK));
        put(SyncFeeds.PARTNER_STACKS_BACKFILL, ceiled(
                STACK_COLUMNS, "stack s", "s.owner_id = :relation_id", "s.update_id", SyncRowMappers.STACK));

        String exifFrom = "asset_exif e join asset a on a.id = e.asset_id";
        put(SyncFeeds.ASSET_EXIFS, of(EXIF_COLUMNS, exifFrom, "a.owner_id = :user_id", "e.update_id", SyncRowMappers.EXIF));
        put(SyncFeeds.PARTNER_ASSET_EXIFS, of(
                EXIF_COLUMNS, exifFrom, "a.owner_id in " + PARTNER_OWNERS, "e.update_id", SyncRowMappers.EXIF));
        put(SyncFeeds.PARTNER_ASSET_EXIFS_BACKFILL, ceiled(
                EXIF_COLUMNS, exifFrom, "a.owner_id = :relation_id", "e.update_id", SyncRowMappers.EXIF));

        put(SyncFeeds.ALBUMS, of(ALBUM_COLUMNS, "album al", "al.id in " + VISIBLE_ALBUMS, "al.update_id", SyncRowMappers.ALBUM));
        put(SyncFeeds.ALBUM_USERS, of(
                "au.album_id, au.user_id, au.role",
                "album_user au",
                "au.album_id in " + VISIBLE_ALBUMS,
                "au.update_id",
                SyncRowMappers.ALBUM_USER));
        put(SyncFeeds.ALBUM_USERS_BACKFILL, ceiled(
                "au.album_id, au.user_id, au.role",
                "album_user au",
                "au.album_id = :relation_id",
                "au.update_id",
                SyncRowMappers.ALBUM_USER));
        put(SyncFeeds.ALBUM_TO_ASSETS, of(
                "aa.album_id, aa.asset_id",
                "album_asset aa",
                "aa.album_id in " + VISIBLE_ALBUMS,
                "aa.update_id",
                SyncRowMappers.ALBUM_TO_ASSET));
        put(SyncFeeds.ALBUM_TO_ASSETS_BACKFILL, ceiled(
                "aa.album_id, aa.asset_id",
                "album_asset aa",
                "aa.album_id = :relation_id",
                "aa.update_id",
                SyncRowMappers.ALBUM_TO_ASSET));

        // creates are keyed by the album link, updates by the asset itself
        String linkedAsset = "album_asset aa join asset a on a.id = aa.asset_id";
        String linkedExif = linkedAsset + " join asset_exif e on e.asset_id = a.id";
        String inVisibleAlbum = "exists (select 1 from album_asset aa where aa.asset_id = a.id and aa.album_id in "
                + VISIBLE_ALBUMS + ")";
        String linkedBeforeCeiling = "exists (select 1 from album_asset lc where lc.asset_id = a.id and lc.album_id in "
                + VISIBLE_ALBUMS + " and lc.update_id <= :ceiling)";
        put(SyncFeeds.ALBUM_ASSET_CREATES, of(
                ASSET_COLUMNS, linkedAsset, "aa.album_id in " + VISIBLE_ALBUMS, "aa.update_id", SyncRowMappers.ASSET));
        put(SyncFeeds.ALBUM_ASSET_UPDATES,
                of(ASSET_COLUMNS, "asset a", inVisibleAlbum, "a.update_id", SyncRowMappers.ASSET)
                        .withCeilingClause(linkedBeforeCeiling));
        put(SyncFeeds.ALBUM_ASSETS_BACKFILL, ceiled(
                ASSET_COLUMNS, linkedAsset, "aa.album_id = :relation_id", "aa.update_id", SyncRowMappers.ASSET));
        put(SyncFeeds.ALBUM_ASSET_EXIF_CREATES, of(
                EXIF_COLUMNS, linkedExif, "aa.album_id in " + VISIBLE_ALBUMS, "aa.update_id", SyncRowMappers.EXIF));
        put(SyncFeeds.ALBUM_ASSET_EXIF_UPDATES,
                of(EXIF_COLUMNS, exifFrom, inVisibleAlbum, "e.update_id", SyncRowMappers.EXIF)
                        .withCeilingClause(linkedBeforeCeiling));
        put(SyncFeeds.ALBUM_ASSET_EXIFS_BACKFILL, ceiled(
                EXIF_COLUMNS, linkedExif, "aa.album_id = :relation_id", "aa.update_id", SyncRowMappers.EXIF));

        put(SyncFeeds.MEMORIES, of(
                MEMORY_COLUMNS, "memory m", "m.owner_id = :user_id", "m.update_id", SyncRowMappers.memory(objectMapper)));
        put(SyncFeeds.MEMORY_TO_ASSETS, of(
                "ma.memory_id, ma.asset_id",
                "memory_asset ma join memory m on m.id = ma.memory_id",
                "m.owner_id = :user_id",
                "ma.update_id",
                SyncRowMappers.MEMORY_ASSET));
        put(SyncFeeds.PEOPLE, of(
                PERSON_COLUMNS, "person pe", "pe.owner_id = :user_id", "pe.update_id", SyncRowMappers.PERSON));
        put(SyncFeeds.ASSET_FACES, of(
                FACE_COLUMNS,
                "asset_face f join asset a on a.id = f.asset_id",
                "a.owner_id = :user_id",
                "f.update_id",
                SyncRowMappers.ASSET_FACE));
        put(SyncFeeds.USER_METADATA, of(
                "um.user_id, um.key, um.value",
                "user_metadata um",
                "um.user_id = :user_id",
                "um.update_id",
                SyncRowMappers.userMetadata(objectMapper)));
        put(SyncFeeds.ASSET_METADATA, of(
                "am.asset_id, am.key, am.value",
                "asset_metadata am join asset a on a.id = am.asset_id",
                "a.owner_id = :user_id",
                "am.update_id",
                SyncRowMappers.assetMetadata(objectMapper)));
    }

    private <P extends SyncPayload> void put(SyncFeed<P> feed, SyncFeedSql<? extends P> sql) {
        feeds.put(feed.name(), sql);
    }
}
