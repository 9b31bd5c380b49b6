package com.syncline.service.storage.impl;

import static com.syncline.service.storage.impl.JdbcRows.date;
import static com.syncline.service.storage.impl.JdbcRows.doubleValue;
import static com.syncline.service.storage.impl.JdbcRows.instant;
import static com.syncline.service.storage.impl.JdbcRows.integer;
import static com.syncline.service.storage.impl.JdbcRows.json;
import static com.syncline.service.storage.impl.JdbcRows.longValue;
import static com.syncline.service.storage.impl.JdbcRows.uuid;

import com.fasterxml.jackson.databind.ObjectMapper;
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
import org.springframework.jdbc.core.RowMapper;

/** Row mappers for the payload columns selected in {@link SyncFeedSql}. */
final class SyncRowMappers {

    private SyncRowMappers() {}

    static final RowMapper<SyncUserV1> USER = (rs, n) -> new SyncUserV1(
            uuid(rs, "id"),
            rs.getString("name"),
            rs.getString("email"),
            rs.getString("avatar_color"),
            instant(rs, "deleted_at"),
            rs.getBoolean("has_profile_image"),
            instant(rs, "profile_changed_at"));

    static final RowMapper<SyncAuthUserV1> AUTH_USER = (rs, n) -> new SyncAuthUserV1(
            uuid(rs, "id"),
            rs.getString("name"),
            rs.getString("email"),
            rs.getString("avatar_color"),
            instant(rs, "deleted_at"),
            rs.getBoolean("has_profile_image"),
            instant(rs, "profile_changed_at"),
            rs.getBoolean("is_admin"),
            rs.getString("pin_code"),
            rs.getString("oauth_id"),
            rs.getString("storage_label"),
            longValue(rs, "quota_size_in_bytes"),
            rs.getLong("quota_usage_in_bytes"));

    static final RowMapper<SyncPartnerV1> PARTNER = (rs, n) -> new SyncPartnerV1(
            uuid(rs, "shared_by_id"), uuid(rs, "shared_with_id"), rs.getBoolean("in_timeline"));

    static final RowMapper<SyncAssetV1> ASSET = (rs, n) -> new SyncAssetV1(
            uuid(rs, "id"),
            uuid(rs, "owner_id"),
            rs.getString("original_file_name"),
            rs.getString("thumbhash"),
            rs.getString("checksum"),
            instant(rs, "file_created_at"),
            instant(rs, "file_modified_at"),
            instant(rs, "local_date_time"),
            rs.getString("duration"),
            rs.getString("type"),
            instant(rs, "deleted_at"),
            rs.getBoolean("is_favorite"),
            rs.getString("visibility"),
            uuid(rs, "live_photo_video_id"),
            uuid(rs, "stack_id"),
            uuid(rs, "library_id"),
            integer(rs, "width"),
            integer(rs, "height"),
            rs.getBoolean("is_edited"));

    static final RowMapper<SyncAssetExifV1> EXIF = (rs, n) -> new SyncAssetExifV1(
            uuid(rs, "asset_id"),
            rs.getString("description"),
            integer(rs, "exif_image_width"),
            integer(rs, "exif_image_height"),
            longValue(rs, "file_size_in_byte"),
            rs.getString("orientation"),
            instant(rs, "date_time_original"),
            instant(rs, "modify_date"),
            rs.getString("time_zone"),
            doubleValue(rs, "latitude"),
            doubleValue(rs, "longitude"),
            rs.getString("projection_type"),
            rs.getString("city"),
            rs.getString("state"),
            rs.getString("country"),
            rs.getString("make"),
            rs.getString("model"),
            rs.getString("lens_model"),
            doubleValue(rs, "f_number"),
            doubleValue(rs, "focal_length"),
            integer(rs, "iso"),
            rs.getString("exposure_time"),
            rs.getString("profile_description"),
            integer(rs, "rating"),
            doubleValue(rs, "fps"));

    static final RowMapper<SyncAlbumV1> ALBUM = (rs, n) -> new SyncAlbumV1(
            uuid(rs, "id"),
            uuid(rs, "owner_id"),
            rs.getString("name"),
            rs.getString("description"),
            instant(rs, "created_at"),
            instant(rs, "updated_at"),
            uuid(rs, "thumbnail_asset_id"),
            rs.getBoolean("is_activity_enabled"),
            rs.getString("sort_order"));

    static final RowMapper<SyncAlbumUserV1> ALBUM_USER =
            (rs, n) -> new SyncAlbumUserV1(uuid(rs, "album_id"), uuid(rs, "user_id"), rs.getString("role"));

    static final RowMapper<SyncAlbumToAssetV1> ALBUM_TO_ASSET =
            (rs, n) -> new SyncAlbumToAssetV1(uuid(rs, "album_id"), uuid(rs, "asset_id"));

    static final RowMapper<SyncMemoryAssetV1> MEMORY_ASSET =
            (rs, n) -> new SyncMemoryAssetV1(uuid(rs, "memory_id"), uuid(rs, "asset_id"));

    static final RowMapper<SyncStackV1> STACK = (rs, n) -> new SyncStackV1(
            uuid(rs, "id"),
            instant(rs, "created_at"),
            instant(rs, "updated_at"),
            uuid(rs, "primary_asset_id"),
            uuid(rs, "owner_id"));

    static final RowMapper<SyncPersonV1> PERSON = (rs, n) -> new SyncPersonV1(
            uuid(rs, "id"),
            instant(rs, "created_at"),
            instant(rs, "updated_at"),
            uuid(rs, "owner_id"),
            rs.getString("name"),
            date(rs, "birth_date"),
            rs.getBoolean("is_hidden"),
            rs.getBoolean("is_favorite"),
            rs.getString("color"),
            uuid(rs, "face_asset_id"));

    static final RowMapper<SyncAssetFaceV1> ASSET_FACE = (rs, n) -> new SyncAssetFaceV1(
            uuid(rs, "id"),
            uuid(rs, "asset_id"),
            uuid(rs, "person_id"),
            rs.getInt("image_width"),
            rs.getInt("image_height"),
            rs.getInt("bounding_box_x1"),
            rs.getInt("bounding_box_y1"),
            rs.getInt("bounding_box_x2"),
            rs.getInt("bounding_box_y2"),
            rs.getString("source_type"));

    static RowMapper<SyncMemoryV1> memory(ObjectMapper mapper) {
        return (rs, n) -> new SyncMemoryV1(
                uuid(rs, "id"),
                instant(rs, "created_at"),
                instant(rs, "updated_at"),
                instant(rs, "deleted_at"),
                uuid(rs, "owner_id"),
                rs.getString("type"),
                json(mapper, rs, "data"),
                rs.getBoolean("is_saved"),
                instant(rs, "memory_at"),
                instant(rs, "seen_at"),
                instant(rs, "show_at"),
                instant(rs, "hide_at"));
    }

    static RowMapper<SyncUserMetadataV1> userMetadata(ObjectMapper mapper) {
        return (rs, n) -> new SyncUserMetadataV1(uuid(rs, "user_id"), rs.getString("key"), json(mapper, rs, "value"));
    }

    static RowMapper<SyncAssetMetadataV1> assetMetadata(ObjectMapper mapper) {
        return (rs, n) ->
                new SyncAssetMetadataV1(uuid(rs, "asset_id"), rs.getString("key"), json(mapper, rs, "value"));
    }
}
