package com.syncline.service.core.tombstone;

import static org.assertj.core.api.Assertions.assertThat;

import com.syncline.service.core.model.VersionClock;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

class TombstoneRecorderTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final TombstoneLog log = Mockito.mock(TombstoneLog.class);
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final TombstoneRecorder recorder = new TombstoneRecorder(log, new VersionClock(clock), clock);

    @Test
    void albumDeleteIsWrittenOncePerRecipient() {
        UUID album = UUID.randomUUID();
        UUID owner = UUID.randomUUID();
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();

        recorder.albumDeleted(album, owner, List.of(first, owner, second));

        List<Tombstone> written = appended(3);
        assertThat(written).extracting(Tombstone::scopeOwnerId).containsExactly(owner, first, second);
        assertThat(written).allSatisfy(t -> {
            assertThat(t.kind()).isEqualTo(TombstoneKind.ALBUM);
            assertThat(t.entityId()).isEqualTo(album.toString());
            assertThat(t.deletedAt()).isEqualTo(NOW);
        });
        assertThat(written).extracting(Tombstone::id).doesNotHaveDuplicates().isSorted();
    }

    @Test
    void memberRemovalDropsMembershipAndAlbumForThatMember() {
        UUID album = UUID.randomUUID();
        UUID owner = UUID.randomUUID();
        UUID member = UUID.randomUUID();

        recorder.albumUserRemoved(album, member, owner);

        List<Tombstone> written = appended(2);
        assertThat(written.get(0).kind()).isEqualTo(TombstoneKind.ALBUM_USER);
        assertThat(written.get(0).extraUuid()).isEqualTo(member);
        assertThat(written.get(0).scopeOwnerId()).isEqualTo(owner);
        assertThat(written.get(1).kind()).isEqualTo(TombstoneKind.ALBUM);
        assertThat(written.get(1).scopeOwnerId()).isEqualTo(member);
    }

    private List<Tombstone> appended(int count) {
        ArgumentCaptor<Tombstone> captor = ArgumentCaptor.forClass(Tombstone.class);
        Mockito.verify(log, Mockito.times(count)).append(captor.capture());
        return captor.getAllValues();
    }
}
