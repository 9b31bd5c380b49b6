package com.syncline.service.storage.impl;

import org.springframework.jdbc.core.RowMapper;

/**
 * Query shape of one feed. The token column orders and bounds the page; {@code ceilingClause}, when present,
 * is applied only if the query carries a ceiling and may reference {@code :ceiling}.
 */
record SyncFeedSql<P>(
        String columns, String from, String scope, String token, String ceilingClause, RowMapper<P> mapper) {

    static final String PARTNER_OWNERS = "(select shared_by_id from partner where shared_with_id = :user_id)";

    static final String VISIBLE_ALBUMS =
            "(select id from album where owner_id = :user_id union select album_id from album_user where user_id = :user_id)";

    static final String USER_COLUMNS =
            "u.id, u.name, u.email, u.avatar_color, u.deleted_at, u.has_profile_image, u.profile_changed_at";

    static final String AUTH_USER_COLUMNS = USER_COLUMNS
            + ", u.is_admin, u.pin_code, u.oauth_id, u.storage_label, u.quota_size_in_bytes, u.quota_usage_in_bytes";

    static final String ASSET_COLUMNS =
            """
            a.id, a.owner_id, a.original_file_name, a.thumbhash, a.checksum, a.file_created_at, a.file_modified_at,
            a.local_date_time, a.duration, a.type, a.deleted_at, a.is_favorite, a.visibility, a.live_photo_video_id,
            a.stack_id, a.library_id, a.width, a.height, a.is_edited""";

    static final String EXIF_COLUMNS =
            """
            e.asset_id, e.description, e.exif_image_width, e.exif_image_height, e.file_size_in_byte, e.orientation,
            e.date_time_original, e.modify_date, e.time_zone, e.latitude, e.longitude, e.projection_type, e.city,
            e.state, e.country, e.make, e.model, e.lens_model, e.f_number, e.focal_length, e.iso, e.exposure_time,
            e.profile_description, e.rating, e.fps""";

    static final String STACK_COLUMNS = "s.id, s.created_at, s.updated_at, s.primary_asset_id, s.owner_id";

    static final String ALBUM_COLUMNS =
            """
            al.id, al.owner_id, al.name, al.description, al.created_at, al.updated_at, al.thumbnail_asset_id,
            al.is_activity_enabled, al.sort_order""";

    static final String MEMORY_COLUMNS =
            """
            m.id, m.created_at, m.updated_at, m.deleted_at, m.owner_id, m.type, m.data, m.is_saved, m.memory_at,
            m.seen_at, m.show_at, m.hide_at""";

    static final String PERSON_COLUMNS =
            """
            pe.id, pe.created_at, pe.updated_at, pe.owner_id, pe.name, pe.birth_date, pe.is_hidden, pe.is_favorite,
            pe.color, pe.face_asset_id""";

    static final String FACE_COLUMNS =
            """
            f.id, f.asset_id, f.person_id, f.image_width, f.image_height, f.bounding_box_x1, f.bounding_box_y1,
            f.bounding_box_x2, f.bounding_box_y2, f.source_type""";

    static <P> SyncFeedSql<P> of(String columns, String from, String scope, String token, RowMapper<P> mapper) {
        return new SyncFeedSql<>(columns, from, scope, token, null, mapper);
    }

    /** Backfill and update feeds: token column also bounded by the ceiling. */
    static <P> SyncFeedSql<P> ceiled(String columns, String from, String scope, String token, RowMapper<P> mapper) {
        return new SyncFeedSql<>(columns, from, scope, token, token + " <= :ceiling", mapper);
    }

    SyncFeedSql<P> withCeilingClause(String clause) {
        return new SyncFeedSql<>(columns, from, scope, token, clause, mapper);
    }

    String render(boolean hasAfter, boolean hasCeiling) {
        StringBuilder sql = new StringBuilder()
                .append("select ").append(columns).append(", ").append(token).append(" as sync_token\n")
                .append("  from ").append(from).append('\n')
                .append(" where ").append(scope).append('\n')
                .append("   and ").append(token).append(" < :before\n");
        if (hasAfter) {
            sql.append("   and ").append(token).append(" > :after\n");
        }
        if (hasCeiling && ceilingClause != null) {
            sql.append("   and ").append(ceilingClause).append('\n');
        }
        return sql.append(" order by ").append(token).append("\n limit :limit").toString();
    }
}
