package com.syncline.service.core.model;

import com.syncline.service.core.error.SyncForbiddenException;
import java.util.Objects;
import java.util.UUID;

/**
 * Caller identity handed over by the authentication layer. API-key callers carry no session and cannot
 * use the checkpointed protocol.
 */
public record SyncAuth(UUID userId, UUID sessionId) {

    public SyncAuth {
        Objects.requireNonNull(userId, "userId");
    }

    public UUID requireSessionId() {
        if (sessionId == null) {
            throw new SyncForbiddenException("Sync endpoints cannot be used with API keys");
        }
        return sessionId;
    }
}
