package com.syncline.service.core.checkpoint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.syncline.service.core.error.CursorInvalidException;
import com.syncline.service.core.model.SyncEntityType;
import com.syncline.service.core.model.TestTokens;
import com.syncline.service.core.model.VersionToken;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class CheckpointMapTest {

    private static final UUID SESSION = UUID.randomUUID();
    private static final VersionToken T = TestTokens.at(Instant.parse("2026-02-01T00:00:00Z"));

    @Test
    void indexesStoredAcksByType() {
        CheckpointMap map = CheckpointMap.of(List.of(checkpoint("AssetV1", "AssetV1|" + T)));

        assertThat(map.token(SyncEntityType.AssetV1)).isEqualTo(T);
        assertThat(map.contains(SyncEntityType.AssetDeleteV1)).isFalse();
        assertThat(map.token(SyncEntityType.AssetDeleteV1)).isNull();
    }

    @Test
    void rejectsRowWhoseAckNamesAnotherType() {
        assertThatThrownBy(() -> CheckpointMap.of(List.of(checkpoint("AssetV1", "AlbumV1|" + T))))
                .isInstanceOf(CursorInvalidException.class);
    }

    @Test
    void rejectsUnknownType() {
        assertThatThrownBy(() -> CheckpointMap.of(List.of(checkpoint("GoneV1", "GoneV1|" + T))))
                .isInstanceOf(CursorInvalidException.class);
    }

    private static SyncCheckpoint checkpoint(String type, String ack) {
        return new SyncCheckpoint(SESSION, type, ack, Instant.EPOCH);
    }
}
