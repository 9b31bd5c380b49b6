package com.syncline.service.core.ack;

import com.syncline.service.core.checkpoint.SyncCheckpointStore;
import com.syncline.service.core.checkpoint.SyncSessionStore;
import com.syncline.service.core.error.SyncProtocolException;
import com.syncline.service.core.error.SyncProtocolException.RejectedItem;
import com.syncline.service.core.model.SyncAuth;
import com.syncline.service.core.model.SyncEntityType;
import com.syncline.service.core.model.SyncRequestType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Clears checkpoints so the next stream open re-sends from scratch. */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncResetService {
    private final SyncCheckpointStore checkpointStore;
    private final SyncSessionStore sessionStore;

    /**
     * Deletes the checkpoints named by {@code names}: request groups expand to their wire types, wire type
     * names are taken as is. No names means a full reset.
     */
    @Transactional
    public void reset(SyncAuth auth, Collection<String> names) {
        UUID sessionId = auth.requireSessionId();
        if (names == null || names.isEmpty()) {
            resetAll(sessionId);
            return;
        }
        Set<SyncEntityType> types = resolve(names);
        int removed = checkpointStore.deleteTypes(sessionId, types);
        log.info("Session {} reset {} checkpoints for {}", sessionId, removed, types);
    }

    @Transactional
    public void resetAll(UUID sessionId) {
        int removed = checkpointStore.deleteAll(sessionId);
        sessionStore.setPendingSyncReset(sessionId, false);
        log.info("Session {} fully reset, {} checkpoints removed", sessionId, removed);
    }

    /** Server-initiated reset: the next stream open only tells the client to start over. */
    @Transactional
    public void requestReset(UUID sessionId) {
        sessionStore.setPendingSyncReset(sessionId, true);
        log.info("Session {} marked for reset", sessionId);
    }

    static Set<SyncEntityType> resolve(Collection<String> names) {
        Set<SyncEntityType> types = EnumSet.noneOf(SyncEntityType.class);
        List<RejectedItem> rejected = new ArrayList<>();
        for (String name : names) {
            Optional<SyncRequestType> group = SyncRequestType.fromName(name);
            if (group.isPresent()) {
                types.addAll(group.get().entityTypes());
                continue;
            }
            Optional<SyncEntityType> type = SyncEntityType.fromName(name);
            if (type.isPresent() && type.get().isAckable()) {
                types.add(type.get());
            } else {
                rejected.add(new RejectedItem(name, "unknown sync type"));
            }
        }
        if (!rejected.isEmpty()) {
            throw new SyncProtocolException("Unknown types in reset request", rejected);
        }
        return types;
    }
}
