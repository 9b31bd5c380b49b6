package com.syncline.service.storage.impl;

import com.syncline.service.core.checkpoint.SyncSessionStore;
import com.syncline.service.core.model.SyncRequestType;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Slf4j
@Repository
public class JdbcSyncSessionStore implements SyncSessionStore {

    private static final String INSERT_GROUP =
            """
        insert into session_sync_group (session_id, type)
        values (:session_id, :type)
        on conflict (session_id, type) do nothing
        """;

    private static final String FIND_GROUPS = "select type from session_sync_group where session_id = :session_id";

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcSyncSessionStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean isPendingSyncReset(UUID sessionId) {
        List<Boolean> flags = jdbc.queryForList(
                "select is_pending_sync_reset from session where id = :id",
                new MapSqlParameterSource("id", sessionId),
                Boolean.class);
        return !flags.isEmpty() && Boolean.TRUE.equals(flags.get(0));
    }

    @Override
    public void setPendingSyncReset(UUID sessionId, boolean pending) {
        jdbc.update(
                "update session set is_pending_sync_reset = :pending where id = :id",
                new MapSqlParameterSource().addValue("id", sessionId).addValue("pending", pending));
    }

    @Override
    public void addStreamedGroups(UUID sessionId, Set<SyncRequestType> groups) {
        if (groups.isEmpty()) {
            return;
        }
        SqlParameterSource[] batch = groups.stream()
                .map(g -> new MapSqlParameterSource()
                        .addValue("session_id", sessionId)
                        .addValue("type", g.name()))
                .toArray(SqlParameterSource[]::new);
        jdbc.batchUpdate(INSERT_GROUP, batch);
    }

    @Override
    public Set<SyncRequestType> findStreamedGroups(UUID sessionId) {
        List<String> names =
                jdbc.queryForList(FIND_GROUPS, new MapSqlParameterSource("session_id", sessionId), String.class);
        Set<SyncRequestType> groups = EnumSet.noneOf(SyncRequestType.class);
        for (String name : names) {
            SyncRequestType.fromName(name)
                    .ifPresentOrElse(
                            groups::add, () -> log.warn("Session {} holds unknown sync group {}", sessionId, name));
        }
        return groups;
    }
}
