package com.syncline.service.core.stream;

import static com.syncline.service.core.support.SyncPayloadSamples.album;
import static org.assertj.core.api.Assertions.assertThat;

import com.syncline.service.core.feed.GrantKind;
import com.syncline.service.core.feed.SyncFeeds;
import com.syncline.service.core.model.SyncAuth;
import com.syncline.service.core.model.SyncEntityType;
import com.syncline.service.core.model.SyncPayload;
import com.syncline.service.core.model.SyncPayloads.SyncAlbumDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncAlbumUserDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncAssetDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncPartnerDeleteV1;
import com.syncline.service.core.model.SyncPayloads.SyncUserDeleteV1;
import com.syncline.service.core.model.SyncRequestType;
import com.syncline.service.core.model.SyncStreamLine;
import com.syncline.service.core.support.SyncFixture;
import com.syncline.service.core.tombstone.TombstoneKind;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

/** Who receives which delete line, one user session per participant. */
class TombstoneVisibilityTest {

    private final SyncFixture fx = new SyncFixture();
    private final UUID owner = UUID.randomUUID();
    private final UUID member = UUID.randomUUID();
    private final UUID stranger = UUID.randomUUID();
    private final SyncAuth ownerAuth = new SyncAuth(owner, UUID.randomUUID());
    private final SyncAuth memberAuth = new SyncAuth(member, UUID.randomUUID());
    private final SyncAuth strangerAuth = new SyncAuth(stranger, UUID.randomUUID());

    @Test
    void sharedAlbumDeleteReachesOwnerAndMembers() {
        UUID albumId = sharedAlbum();
        fx.ackAll(memberAuth, fx.open(memberAuth, SyncRequestType.AlbumsV1));
        fx.ackAll(ownerAuth, fx.open(ownerAuth, SyncRequestType.AlbumsV1));

        fx.clock.advance(Duration.ofMinutes(1));
        fx.store.removeRows(SyncFeeds.ALBUMS, owner);
        fx.store.removeRows(SyncFeeds.ALBUMS, member);
        fx.tombstones.albumDeleted(albumId, owner, List.of(member));

        List<SyncStreamLine> memberLines = fx.open(memberAuth, SyncRequestType.AlbumsV1);
        assertThat(types(memberLines)).containsExactly(SyncEntityType.AlbumDeleteV1, SyncEntityType.SyncCompleteV1);
        assertThat(memberLines.get(0).data()).isEqualTo(new SyncAlbumDeleteV1(albumId));

        assertThat(payloads(fx.open(ownerAuth, SyncRequestType.AlbumsV1), SyncEntityType.AlbumDeleteV1))
                .containsExactly(new SyncAlbumDeleteV1(albumId));
        assertThat(types(fx.open(strangerAuth, SyncRequestType.AlbumsV1)))
                .containsExactly(SyncEntityType.SyncCompleteV1);
    }

    @Test
    void removedMemberLosesAlbumAndMembership() {
        UUID albumId = sharedAlbum();
        UUID other = UUID.randomUUID();
        fx.store.addGrant(GrantKind.ALBUM_MEMBERSHIP, other, albumId, fx.token());
        fx.ackAll(memberAuth, fx.open(memberAuth, SyncRequestType.AlbumsV1));

        fx.clock.advance(Duration.ofMinutes(1));
        fx.store.removeGrant(GrantKind.ALBUM_MEMBERSHIP, member, albumId);
        fx.store.removeRows(SyncFeeds.ALBUMS, member);
        fx.tombstones.albumUserRemoved(albumId, member, owner);

        SyncAlbumUserDeleteV1 membershipGone = new SyncAlbumUserDeleteV1(albumId, member);
        assertThat(payloads(fx.open(memberAuth, SyncRequestType.AlbumUsersV1), SyncEntityType.AlbumUserDeleteV1))
                .containsExactly(membershipGone);
        assertThat(payloads(fx.open(ownerAuth, SyncRequestType.AlbumUsersV1), SyncEntityType.AlbumUserDeleteV1))
                .containsExactly(membershipGone);
        SyncAuth otherAuth = new SyncAuth(other, UUID.randomUUID());
        assertThat(payloads(fx.open(otherAuth, SyncRequestType.AlbumUsersV1), SyncEntityType.AlbumUserDeleteV1))
                .containsExactly(membershipGone);
        assertThat(payloads(fx.open(strangerAuth, SyncRequestType.AlbumUsersV1), SyncEntityType.AlbumUserDeleteV1))
                .isEmpty();

        assertThat(payloads(fx.open(memberAuth, SyncRequestType.AlbumsV1), SyncEntityType.AlbumDeleteV1))
                .containsExactly(new SyncAlbumDeleteV1(albumId));
        assertThat(payloads(fx.open(ownerAuth, SyncRequestType.AlbumsV1), SyncEntityType.AlbumDeleteV1))
                .isEmpty();
    }

    @Test
    void partnerRemovalReachesBothSides() {
        fx.tombstones.record(TombstoneKind.PARTNER, owner.toString(), member.toString(), owner);

        SyncPartnerDeleteV1 removed = new SyncPartnerDeleteV1(owner, member);
        assertThat(payloads(fx.open(ownerAuth, SyncRequestType.PartnersV1), SyncEntityType.PartnerDeleteV1))
                .containsExactly(removed);
        assertThat(payloads(fx.open(memberAuth, SyncRequestType.PartnersV1), SyncEntityType.PartnerDeleteV1))
                .containsExactly(removed);
        assertThat(payloads(fx.open(strangerAuth, SyncRequestType.PartnersV1), SyncEntityType.PartnerDeleteV1))
                .isEmpty();
    }

    @Test
    void partnerAssetDeletesFollowTheShare() {
        fx.store.addGrant(GrantKind.PARTNER, member, owner, fx.token());
        UUID assetId = UUID.randomUUID();
        fx.tombstones.record(TombstoneKind.ASSET, assetId.toString(), null, owner);

        assertThat(payloads(fx.open(memberAuth, SyncRequestType.PartnerAssetsV1), SyncEntityType.PartnerAssetDeleteV1))
                .containsExactly(new SyncAssetDeleteV1(assetId));
        assertThat(payloads(fx.open(strangerAuth, SyncRequestType.PartnerAssetsV1), SyncEntityType.PartnerAssetDeleteV1))
                .isEmpty();
        assertThat(payloads(fx.open(ownerAuth, SyncRequestType.AssetsV1), SyncEntityType.AssetDeleteV1))
                .containsExactly(new SyncAssetDeleteV1(assetId));
    }

    @Test
    void userDeleteReachesEveryone() {
        UUID gone = UUID.randomUUID();
        fx.tombstones.record(TombstoneKind.USER, gone.toString(), null, null);

        assertThat(payloads(fx.open(strangerAuth, SyncRequestType.UsersV1), SyncEntityType.UserDeleteV1))
                .containsExactly(new SyncUserDeleteV1(gone));
        assertThat(payloads(fx.open(memberAuth, SyncRequestType.UsersV1), SyncEntityType.UserDeleteV1))
                .containsExactly(new SyncUserDeleteV1(gone));
    }

    private UUID sharedAlbum() {
        UUID albumId = UUID.randomUUID();
        fx.store.addAlbum(albumId, owner);
        fx.store.addGrant(GrantKind.ALBUM_MEMBERSHIP, member, albumId, fx.token());
        fx.store.addRow(SyncFeeds.ALBUMS, fx.token(), album(albumId, owner, "Shared"), owner);
        fx.store.addRow(SyncFeeds.ALBUMS, fx.token(), album(albumId, owner, "Shared"), member);
        return albumId;
    }

    private static List<SyncEntityType> types(List<SyncStreamLine> lines) {
        return lines.stream().map(SyncStreamLine::type).toList();
    }

    private static List<SyncPayload> payloads(List<SyncStreamLine> lines, SyncEntityType type) {
        return lines.stream().filter(l -> l.type() == type).map(SyncStreamLine::data).toList();
    }
}
