package com.syncline.service.core.legacy;

import com.syncline.service.core.config.SyncProperties;
import com.syncline.service.core.error.SyncForbiddenException;
import com.syncline.service.core.error.SyncProtocolException;
import com.syncline.service.core.model.SyncAuth;
import com.syncline.service.core.tombstone.TombstoneKind;
import com.syncline.service.core.tombstone.TombstoneLog;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Timestamp-based asset sync kept for clients that predate the stream protocol. */
@Slf4j
@Service
@RequiredArgsConstructor
public class LegacyAssetSyncService {
    private final LegacyAssetRepository assets;
    private final TombstoneLog tombstones;
    private final SyncProperties properties;
    private final Clock clock;

    public List<AssetResponse> getFullSync(SyncAuth auth, AssetFullSyncRequest request) {
        if (request.updatedUntil() == null) {
            throw new SyncProtocolException("updatedUntil is required");
        }
        if (request.limit() <= 0) {
            throw new SyncProtocolException("limit must be positive");
        }
        UUID ownerId = request.userId() == null ? auth.userId() : request.userId();
        requireAccess(auth, List.of(ownerId));
        return assets.findPage(ownerId, request.lastId(), request.updatedUntil(), request.limit());
    }

    public AssetDeltaSyncResponse getDeltaSync(SyncAuth auth, AssetDeltaSyncRequest request) {
        if (request.updatedAfter() == null) {
            throw new SyncProtocolException("updatedAfter is required");
        }
        if (request.userIds() == null || request.userIds().isEmpty()) {
            throw new SyncProtocolException("userIds must not be empty");
        }
        requireAccess(auth, request.userIds());

        Instant oldest = clock.instant().minus(properties.getLegacy().getDeltaMaxAge());
        if (request.updatedAfter().isBefore(oldest)) {
            log.debug("Delta sync for {} from {} is older than {}", auth.userId(), request.updatedAfter(), oldest);
            return AssetDeltaSyncResponse.fullSyncRequired();
        }

        int limit = properties.getLegacy().getDeltaLimit();
        List<AssetResponse> changed = assets.findUpdatedAfter(request.userIds(), request.updatedAfter(), limit);
        if (changed.size() >= limit) {
            log.debug("Delta sync for {} hit the {} row limit", auth.userId(), limit);
            return AssetDeltaSyncResponse.fullSyncRequired();
        }

        List<AssetResponse> upserted = changed.stream()
                .filter(a -> a.ownerId().equals(auth.userId())
                        || AssetResponse.VISIBILITY_TIMELINE.equals(a.visibility()))
                .map(a -> a.ownerId().equals(auth.userId()) ? a : a.withoutStack())
                .toList();
        List<String> deleted =
                tombstones.deletedEntityIds(TombstoneKind.ASSET, request.userIds(), request.updatedAfter());
        return new AssetDeltaSyncResponse(false, upserted, deleted);
    }

    private void requireAccess(SyncAuth auth, Collection<UUID> ownerIds) {
        Set<UUID> partners = null;
        for (UUID ownerId : ownerIds) {
            if (ownerId.equals(auth.userId())) {
                continue;
            }
            if (partners == null) {
                partners = assets.findPartnerIdsSharingWith(auth.userId());
            }
            if (!partners.contains(ownerId)) {
                throw new SyncForbiddenException("Not allowed to sync assets of user " + ownerId);
            }
        }
    }
}
