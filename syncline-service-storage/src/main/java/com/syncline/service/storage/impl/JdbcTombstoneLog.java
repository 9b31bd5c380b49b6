package com.syncline.service.storage.impl;

import com.syncline.service.core.feed.FeedQuery;
import com.syncline.service.core.tombstone.Tombstone;
import com.syncline.service.core.tombstone.TombstoneKind;
import com.syncline.service.core.tombstone.TombstoneLog;
import com.syncline.service.core.tombstone.TombstoneScope;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcTombstoneLog implements TombstoneLog {

    private static final String VISIBLE_ALBUMS =
            "(select id from album where owner_id = :user_id union select album_id from album_user where user_id = :user_id)";

    /** Visibility predicate per scope, applied to alias {@code t}. */
    private static final Map<TombstoneScope, String> SCOPES = new EnumMap<>(TombstoneScope.class);

    static {
        SCOPES.put(TombstoneScope.GLOBAL, "1 = 1");
        SCOPES.put(TombstoneScope.OWNER, "t.scope_owner_id = :user_id");
        SCOPES.put(
                TombstoneScope.PARTNER_OWNED,
                "t.scope_owner_id in (select shared_by_id from partner where shared_with_id = :user_id)");
        SCOPES.put(
                TombstoneScope.PARTNER_PAIR,
                "(t.entity_id = cast(:user_id as varchar) or t.extra_id = cast(:user_id as varchar))");
        SCOPES.put(TombstoneScope.ALBUM_SCOPED, "cast(t.entity_id as uuid) in " + VISIBLE_ALBUMS);
        SCOPES.put(
                TombstoneScope.ALBUM_MEMBER,
                "(cast(t.entity_id as uuid) in " + VISIBLE_ALBUMS + " or t.extra_id = cast(:user_id as varchar))");
    }

    private static final String INSERT =
            """
        insert into sync_tombstone (id, entity_kind, entity_id, extra_id, scope_owner_id, deleted_at)
        values (:id, :entity_kind, :entity_id, :extra_id, :scope_owner_id, :deleted_at)
        """;

    private static final String SELECT =
            """
        select t.id, t.entity_kind, t.entity_id, t.extra_id, t.scope_owner_id, t.deleted_at
          from sync_tombstone t
         where t.entity_kind = :entity_kind
           and t.id < :before
        """;

    private static final String DELETED_IDS =
            """
        select t.entity_id
          from sync_tombstone t
         where t.entity_kind = :entity_kind
           and t.scope_owner_id in (:owner_ids)
           and t.deleted_at > :deleted_after
         order by t.id
        """;

    private static final String PURGE = "delete from sync_tombstone where deleted_at < :cutoff";

    private static final RowMapper<Tombstone> ROW_MAPPER = (rs, rowNum) -> new Tombstone(
            JdbcRows.token(rs, "id"),
            TombstoneKind.valueOf(rs.getString("entity_kind")),
            rs.getString("entity_id"),
            rs.getString("extra_id"),
            JdbcRows.uuid(rs, "scope_owner_id"),
            JdbcRows.instant(rs, "deleted_at"));

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcTombstoneLog(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void append(Tombstone tombstone) {
        jdbc.update(
                INSERT,
                new MapSqlParameterSource()
                        .addValue("id", tombstone.id().value())
                        .addValue("entity_kind", tombstone.kind().name())
                        .addValue("entity_id", tombstone.entityId())
                        .addValue("extra_id", tombstone.extraId())
                        .addValue("scope_owner_id", tombstone.scopeOwnerId())
                        .addValue("deleted_at", utc(tombstone.deletedAt()), Types.TIMESTAMP_WITH_TIMEZONE));
    }

    @Override
    public List<Tombstone> read(TombstoneKind kind, TombstoneScope scope, FeedQuery query) {
        StringBuilder sql = new StringBuilder(SELECT).append("   and ").append(SCOPES.get(scope)).append('\n');
        MapSqlParameterSource p = new MapSqlParameterSource()
                .addValue("entity_kind", kind.name())
                .addValue("user_id", query.userId())
                .addValue("before", query.before().value())
                .addValue("limit", query.limit());
        if (query.after() != null) {
            sql.append("   and t.id > :after\n");
            p.addValue("after", query.after().value());
        }
        sql.append(" order by t.id\n limit :limit");
        return jdbc.query(sql.toString(), p, ROW_MAPPER);
    }

    @Override
    public List<String> deletedEntityIds(TombstoneKind kind, Collection<UUID> scopeOwnerIds, Instant deletedAfter) {
        if (scopeOwnerIds.isEmpty()) {
            return List.of();
        }
        return jdbc.queryForList(
                DELETED_IDS,
                new MapSqlParameterSource()
                        .addValue("entity_kind", kind.name())
                        .addValue("owner_ids", scopeOwnerIds)
                        .addValue("deleted_after", utc(deletedAfter), Types.TIMESTAMP_WITH_TIMEZONE),
                String.class);
    }

    @Override
    public int purgeDeletedBefore(Instant cutoff) {
        return jdbc.update(
                PURGE, new MapSqlParameterSource().addValue("cutoff", utc(cutoff), Types.TIMESTAMP_WITH_TIMEZONE));
    }

    private static OffsetDateTime utc(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
