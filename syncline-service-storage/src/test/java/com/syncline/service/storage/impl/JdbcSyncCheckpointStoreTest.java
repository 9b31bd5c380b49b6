package com.syncline.service.storage.impl;

import static org.assertj.core.api.Assertions.assertThat;

import com.syncline.service.core.model.SyncAck;
import com.syncline.service.core.model.SyncEntityType;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

class JdbcSyncCheckpointStoreTest {

    private static final String EARLY = "0195f2a0-0000-7000-8000-000000000000";
    private static final String LATE = "0195f2a0-0001-7000-8000-000000000000";

    private final NamedParameterJdbcTemplate jdbc = Mockito.mock(NamedParameterJdbcTemplate.class);
    private final JdbcSyncCheckpointStore store = new JdbcSyncCheckpointStore(
            jdbc, Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC));
    private final UUID session = UUID.randomUUID();

    @Test
    void firstAckIsInserted() {
        Mockito.when(jdbc.update(Mockito.contains("on conflict"), Mockito.any(SqlParameterSource.class)))
                .thenReturn(1);

        int advanced = store.advance(session, List.of(ack(EARLY)));

        assertThat(advanced).isEqualTo(1);
        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        Mockito.verify(jdbc).update(Mockito.contains("on conflict"), params.capture());
        assertThat(params.getValue().getValue("type")).isEqualTo("AssetV1");
        assertThat(params.getValue().getValue("ack")).isEqualTo("AssetV1|" + EARLY);
        Mockito.verify(jdbc, Mockito.never())
                .queryForList(Mockito.anyString(), Mockito.any(SqlParameterSource.class), Mockito.eq(String.class));
    }

    @Test
    void olderAckLeavesStoredCheckpoint() {
        storedAck("AssetV1|" + LATE);

        int advanced = store.advance(session, List.of(ack(EARLY)));

        assertThat(advanced).isZero();
        Mockito.verify(jdbc, Mockito.never())
                .update(Mockito.contains("update session_sync_checkpoint"), Mockito.any(SqlParameterSource.class));
    }

    @Test
    void newerAckReplacesStoredCheckpoint() {
        storedAck("AssetV1|" + EARLY);

        int advanced = store.advance(session, List.of(ack(LATE)));

        assertThat(advanced).isEqualTo(1);
        Mockito.verify(jdbc)
                .update(Mockito.contains("update session_sync_checkpoint"), Mockito.any(SqlParameterSource.class));
    }

    @Test
    void unreadableStoredValueIsOverwritten() {
        storedAck("garbage");

        assertThat(store.advance(session, List.of(ack(EARLY)))).isEqualTo(1);
    }

    @Test
    void deletingNoTypesTouchesNothing() {
        assertThat(store.deleteTypes(session, List.of())).isZero();
        Mockito.verifyNoInteractions(jdbc);
    }

    @Test
    void deletesNamedTypesOnly() {
        Mockito.when(jdbc.update(Mockito.contains("type in (:types)"), Mockito.any(SqlParameterSource.class)))
                .thenReturn(2);

        int removed = store.deleteTypes(session, List.of(SyncEntityType.AssetV1, SyncEntityType.AssetDeleteV1));

        assertThat(removed).isEqualTo(2);
        ArgumentCaptor<SqlParameterSource> params = ArgumentCaptor.forClass(SqlParameterSource.class);
        Mockito.verify(jdbc).update(Mockito.anyString(), params.capture());
        assertThat(params.getValue().getValue("types")).isEqualTo(List.of("AssetV1", "AssetDeleteV1"));
    }

    private void storedAck(String stored) {
        Mockito.when(jdbc.update(Mockito.contains("on conflict"), Mockito.any(SqlParameterSource.class)))
                .thenReturn(0);
        Mockito.when(jdbc.queryForList(
                        Mockito.contains("for update"), Mockito.any(SqlParameterSource.class), Mockito.eq(String.class)))
                .thenReturn(List.of(stored));
    }

    private static SyncAck ack(String token) {
        return new SyncAck(SyncEntityType.AssetV1, token, null);
    }
}
