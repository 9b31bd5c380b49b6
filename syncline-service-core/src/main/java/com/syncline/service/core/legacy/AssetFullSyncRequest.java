package com.syncline.service.core.legacy;

import java.time.Instant;
import java.util.UUID;

/**
 * @param lastId exclusive id to resume after, null for the first page
 * @param updatedUntil only assets updated at or before this instant
 * @param limit page size
 * @param userId library owner, null for the caller
 */
public record AssetFullSyncRequest(UUID lastId, Instant updatedUntil, int limit, UUID userId) {}
