package com.syncline.service.core.legacy;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record AssetDeltaSyncRequest(Instant updatedAfter, List<UUID> userIds) {}
