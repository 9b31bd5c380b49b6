package com.syncline.service.storage.impl;

import com.syncline.service.core.checkpoint.SyncCheckpoint;
import com.syncline.service.core.checkpoint.SyncCheckpointStore;
import com.syncline.service.core.error.CursorInvalidException;
import com.syncline.service.core.model.SyncAck;
import com.syncline.service.core.model.SyncEntityType;
import java.sql.Types;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Repository
public class JdbcSyncCheckpointStore implements SyncCheckpointStore {

    private static final String FIND_BY_SESSION =
            """
        select session_id, type, ack, updated_at
          from session_sync_checkpoint
         where session_id = :session_id
         order by type
        """;

    private static final String LOCK_ONE =
            """
        select ack
          from session_sync_checkpoint
         where session_id = :session_id and type = :type
           for update
        """;

    private static final String INSERT_IF_ABSENT =
            """
        insert into session_sync_checkpoint (session_id, type, ack, updated_at)
        values (:session_id, :type, :ack, :updated_at)
        on conflict (session_id, type) do nothing
        """;

    private static final String UPDATE_ONE =
            """
        update session_sync_checkpoint
           set ack = :ack, updated_at = :updated_at
         where session_id = :session_id and type = :type
        """;

    private static final String DELETE_ALL = "delete from session_sync_checkpoint where session_id = :session_id";

    private static final String DELETE_TYPES =
            "delete from session_sync_checkpoint where session_id = :session_id and type in (:types)";

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public JdbcSyncCheckpointStore(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    @Override
    public List<SyncCheckpoint> findBySession(UUID sessionId) {
        return jdbc.query(
                FIND_BY_SESSION,
                new MapSqlParameterSource("session_id", sessionId),
                (rs, rowNum) -> new SyncCheckpoint(
                        rs.getObject("session_id", UUID.class),
                        rs.getString("type"),
                        rs.getString("ack"),
                        JdbcRows.instant(rs, "updated_at")));
    }

    /**
     * Per type: insert when absent, otherwise lock the row and keep the greater ack. Runs as one
     * transaction so a batch lands completely or not at all.
     */
    @Override
    @Transactional
    public int advance(UUID sessionId, Collection<SyncAck> acks) {
        OffsetDateTime now = OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
        int advanced = 0;
        for (SyncAck ack : acks) {
            MapSqlParameterSource p = new MapSqlParameterSource()
                    .addValue("session_id", sessionId)
                    .addValue("type", ack.type().name())
                    .addValue("ack", ack.encode())
                    .addValue("updated_at", now, Types.TIMESTAMP_WITH_TIMEZONE);

            if (jdbc.update(INSERT_IF_ABSENT, p) == 1) {
                advanced++;
                continue;
            }
            List<String> current = jdbc.queryForList(LOCK_ONE, p, String.class);
            if (current.isEmpty() || ack.isAfter(parseStored(current.get(0), ack.type()))) {
                jdbc.update(UPDATE_ONE, p);
                advanced++;
            } else if (log.isDebugEnabled()) {
                log.debug("Ignoring stale ack {} for session {} (stored {})", ack, sessionId, current.get(0));
            }
        }
        return advanced;
    }

    @Override
    public int deleteAll(UUID sessionId) {
        return jdbc.update(DELETE_ALL, new MapSqlParameterSource("session_id", sessionId));
    }

    @Override
    public int deleteTypes(UUID sessionId, Collection<SyncEntityType> types) {
        if (types.isEmpty()) {
            return 0;
        }
        return jdbc.update(
                DELETE_TYPES,
                new MapSqlParameterSource()
                        .addValue("session_id", sessionId)
                        .addValue("types", types.stream().map(Enum::name).toList()));
    }

    /** A stored value that no longer parses is overwritten. */
    private static SyncAck parseStored(String stored, SyncEntityType type) {
        try {
            SyncAck ack = SyncAck.parse(stored);
            return ack.type() == type ? ack : null;
        } catch (CursorInvalidException e) {
            log.warn("Replacing unreadable checkpoint {} for {}: {}", stored, type, e.getMessage());
            return null;
        }
    }
}
