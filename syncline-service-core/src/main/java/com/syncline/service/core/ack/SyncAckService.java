package com.syncline.service.core.ack;

import com.syncline.service.core.checkpoint.SyncCheckpointStore;
import com.syncline.service.core.checkpoint.SyncSessionStore;
import com.syncline.service.core.config.SyncProperties;
import com.syncline.service.core.error.CursorInvalidException;
import com.syncline.service.core.error.SyncProtocolException;
import com.syncline.service.core.error.SyncProtocolException.RejectedItem;
import com.syncline.service.core.model.SyncAck;
import com.syncline.service.core.model.SyncAuth;
import com.syncline.service.core.model.SyncEntityType;
import com.syncline.service.core.model.SyncRequestType;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Accepts client acknowledgements and turns them into durable checkpoints. */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncAckService {
    private final SyncCheckpointStore checkpointStore;
    private final SyncSessionStore sessionStore;
    private final SyncResetService resetService;
    private final SyncProperties properties;

    public List<SyncAckView> getAcks(SyncAuth auth) {
        UUID sessionId = auth.requireSessionId();
        return checkpointStore.findBySession(sessionId).stream()
                .map(c -> new SyncAckView(c.type(), c.ack()))
                .toList();
    }

    /**
     * Parses every ack on its own, keeps the highest per type and commits them in one batch. Entries that
     * fail to parse, or whose type no group streamed to this session can produce, are reported after the
     * rest has been committed.
     *
     * <p>An ack of {@code SyncResetV1} resets the session and ends the batch: later entries are neither
     * checked nor committed, and nothing collected before it is committed either. Entries rejected before
     * the reset are still reported.
     *
     * @return number of checkpoints that moved forward
     * @throws SyncProtocolException if the batch is empty, too large, or any entry was rejected
     */
    public int setAcks(SyncAuth auth, List<String> acks) {
        UUID sessionId = auth.requireSessionId();
        if (acks == null || acks.isEmpty()) {
            throw new SyncProtocolException("At least one ack is required");
        }
        if (acks.size() > properties.getMaxAcks()) {
            throw new SyncProtocolException(
                    "Too many acks: " + acks.size() + " (max " + properties.getMaxAcks() + ")");
        }

        Set<SyncEntityType> streamable = streamableTypes(sessionId);
        Map<SyncEntityType, SyncAck> highest = new EnumMap<>(SyncEntityType.class);
        List<RejectedItem> rejected = new ArrayList<>();
        for (String raw : acks) {
            SyncAck ack;
            try {
                ack = SyncAck.parse(raw).validated();
            } catch (CursorInvalidException e) {
                rejected.add(new RejectedItem(raw, e.getMessage()));
                continue;
            }
            if (ack.type() == SyncEntityType.SyncResetV1) {
                resetService.resetAll(sessionId);
                return rejectedOr(0, rejected, acks.size(), sessionId);
            }
            if (!ack.type().isAckable()) {
                rejected.add(new RejectedItem(raw, ack.type() + " cannot be acknowledged"));
                continue;
            }
            if (!streamable.contains(ack.type())) {
                rejected.add(new RejectedItem(raw, ack.type() + " was never streamed to this session"));
                continue;
            }
            highest.merge(ack.type(), ack, (a, b) -> b.isAfter(a) ? b : a);
        }

        int advanced = highest.isEmpty() ? 0 : checkpointStore.advance(sessionId, highest.values());
        log.debug("Session {} advanced {} of {} checkpoints", sessionId, advanced, highest.size());
        return rejectedOr(advanced, rejected, acks.size(), sessionId);
    }

    private Set<SyncEntityType> streamableTypes(UUID sessionId) {
        Set<SyncRequestType> groups = sessionStore.findStreamedGroups(sessionId);
        Set<SyncEntityType> types = EnumSet.noneOf(SyncEntityType.class);
        for (SyncRequestType group : groups) {
            types.addAll(group.entityTypes());
        }
        if (!groups.isEmpty()) {
            types.add(SyncEntityType.SyncCompleteV1);
        }
        return types;
    }

    private static int rejectedOr(int advanced, List<RejectedItem> rejected, int total, UUID sessionId) {
        if (!rejected.isEmpty()) {
            log.warn("Session {} sent {} invalid acks", sessionId, rejected.size());
            throw new SyncProtocolException("Rejected " + rejected.size() + " of " + total + " acks", rejected);
        }
        return advanced;
    }
}
