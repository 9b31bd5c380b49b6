package com.syncline.service.core.legacy;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;

public interface LegacyAssetRepository {

    /** Assets of {@code ownerId} updated at or before {@code updatedUntil} with id after {@code lastId}, by id. */
    List<AssetResponse> findPage(UUID ownerId, UUID lastId, Instant updatedUntil, int limit);

    /** Assets of any of {@code ownerIds} updated strictly after {@code updatedAfter}, by update time. */
    List<AssetResponse> findUpdatedAfter(Collection<UUID> ownerIds, Instant updatedAfter, int limit);

    /** Users who share their library with {@code userId}. */
    Set<UUID> findPartnerIdsSharingWith(UUID userId);
}
