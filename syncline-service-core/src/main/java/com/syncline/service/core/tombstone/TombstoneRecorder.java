package com.syncline.service.core.tombstone;

import com.syncline.service.core.model.VersionClock;
import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Entry point for business services removing syncable rows. Each tombstone gets its own version token, so
 * a deletion fanned out to several users appends one row per user.
 *
 * <p>{@link TombstoneKind#ALBUM} tombstones are read with {@link TombstoneScope#OWNER} and therefore carry
 * the recipient as scope owner: the album owner and every member at deletion time, and a member who is
 * removed from an album that still exists.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TombstoneRecorder {
    private final TombstoneLog tombstones;
    private final VersionClock versionClock;
    private final Clock clock;

    @Transactional
    public Tombstone record(TombstoneKind kind, String entityId, String extraId, UUID scopeOwnerId) {
        Tombstone tombstone =
                new Tombstone(versionClock.next(), kind, entityId, extraId, scopeOwnerId, clock.instant());
        tombstones.append(tombstone);
        return tombstone;
    }

    /** Album removed: everyone who could see it gets an {@code AlbumDeleteV1}. */
    @Transactional
    public void albumDeleted(UUID albumId, UUID ownerId, Collection<UUID> memberIds) {
        Set<UUID> recipients = new LinkedHashSet<>();
        recipients.add(ownerId);
        recipients.addAll(memberIds);
        for (UUID recipient : recipients) {
            record(TombstoneKind.ALBUM, albumId.toString(), null, recipient);
        }
        log.debug("Album {} deleted for {} users", albumId, recipients.size());
    }

    /**
     * Member removed from an album: the membership row goes for everyone still sharing the album, and the
     * album itself goes for the removed member.
     */
    @Transactional
    public void albumUserRemoved(UUID albumId, UUID userId, UUID ownerId) {
        record(TombstoneKind.ALBUM_USER, albumId.toString(), userId.toString(), ownerId);
        record(TombstoneKind.ALBUM, albumId.toString(), null, userId);
    }
}
