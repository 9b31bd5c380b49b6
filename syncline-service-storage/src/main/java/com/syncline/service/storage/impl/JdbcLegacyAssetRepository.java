package com.syncline.service.storage.impl;

import static com.syncline.service.storage.impl.JdbcRows.instant;
import static com.syncline.service.storage.impl.JdbcRows.integer;
import static com.syncline.service.storage.impl.JdbcRows.uuid;

import com.syncline.service.core.legacy.AssetResponse;
import com.syncline.service.core.legacy.LegacyAssetRepository;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcLegacyAssetRepository implements LegacyAssetRepository {

    private static final String COLUMNS =
            """
        select id, owner_id, type, original_file_name, checksum, thumbhash, file_created_at, file_modified_at,
               local_date_time, updated_at, is_favorite, visibility, deleted_at, duration, live_photo_video_id,
               stack_id, library_id, width, height
          from asset
        """;

    private static final String UPDATED_AFTER =
            """
         where owner_id in (:owner_ids)
           and updated_at > :updated_after
         order by updated_at
         limit :limit
        """;

    private static final RowMapper<AssetResponse> ROW_MAPPER = (rs, n) -> new AssetResponse(
            uuid(rs, "id"),
            uuid(rs, "owner_id"),
            rs.getString("type"),
            rs.getString("original_file_name"),
            rs.getString("checksum"),
            rs.getString("thumbhash"),
            instant(rs, "file_created_at"),
            instant(rs, "file_modified_at"),
            instant(rs, "local_date_time"),
            instant(rs, "updated_at"),
            rs.getBoolean("is_favorite"),
            rs.getString("visibility"),
            rs.getObject("deleted_at") != null,
            instant(rs, "deleted_at"),
            rs.getString("duration"),
            uuid(rs, "live_photo_video_id"),
            uuid(rs, "stack_id"),
            uuid(rs, "library_id"),
            integer(rs, "width"),
            integer(rs, "height"));

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcLegacyAssetRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public List<AssetResponse> findPage(UUID ownerId, UUID lastId, Instant updatedUntil, int limit) {
        StringBuilder sql = new StringBuilder(COLUMNS)
                .append(" where owner_id = :owner_id\n   and updated_at <= :updated_until\n");
        MapSqlParameterSource p = new MapSqlParameterSource()
                .addValue("owner_id", ownerId)
                .addValue("updated_until", utc(updatedUntil), Types.TIMESTAMP_WITH_TIMEZONE)
                .addValue("limit", limit);
        if (lastId != null) {
            sql.append("   and id > :last_id\n");
            p.addValue("last_id", lastId);
        }
        sql.append(" order by id\n limit :limit");
        return jdbc.query(sql.toString(), p, ROW_MAPPER);
    }

    @Override
    public List<AssetResponse> findUpdatedAfter(Collection<UUID> ownerIds, Instant updatedAfter, int limit) {
        return jdbc.query(
                COLUMNS + UPDATED_AFTER,
                new MapSqlParameterSource()
                        .addValue("owner_ids", ownerIds)
                        .addValue("updated_after", utc(updatedAfter), Types.TIMESTAMP_WITH_TIMEZONE)
                        .addValue("limit", limit),
                ROW_MAPPER);
    }

    @Override
    public Set<UUID> findPartnerIdsSharingWith(UUID userId) {
        return new HashSet<>(jdbc.queryForList(
                "select shared_by_id from partner where shared_with_id = :user_id",
                new MapSqlParameterSource("user_id", userId),
                UUID.class));
    }

    private static OffsetDateTime utc(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
