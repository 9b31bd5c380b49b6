package com.syncline.service.core.checkpoint;

import com.syncline.service.core.model.SyncRequestType;
import java.util.Set;
import java.util.UUID;

/** Sync-related state of a login session; sessions themselves are issued by the auth layer. */
public interface SyncSessionStore {

    boolean isPendingSyncReset(UUID sessionId);

    void setPendingSyncReset(UUID sessionId, boolean pending);

    /** Records request groups a stream open delivered to the session. Already recorded groups are kept. */
    void addStreamedGroups(UUID sessionId, Set<SyncRequestType> groups);

    /** Every request group ever streamed to the session; empty if it never opened a stream. */
    Set<SyncRequestType> findStreamedGroups(UUID sessionId);
}
