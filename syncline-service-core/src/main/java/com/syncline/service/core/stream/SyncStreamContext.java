package com.syncline.service.core.stream;

import com.syncline.service.core.checkpoint.CheckpointMap;
import com.syncline.service.core.feed.FeedQuery;
import com.syncline.service.core.model.SyncAck;
import com.syncline.service.core.model.SyncEntityType;
import com.syncline.service.core.model.SyncPayload;
import com.syncline.service.core.model.SyncStreamLine;
import com.syncline.service.core.model.VersionToken;
import java.io.IOException;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/** State of one stream open: who is syncing, from which checkpoints, and up to which token. */
public class SyncStreamContext {
    private final UUID userId;
    private final UUID sessionId;
    private final CheckpointMap checkpoints;
    private final VersionToken nowId;
    private final int pageSize;
    private final SyncStreamSink sink;
    private final Map<SyncEntityType, Integer> sent = new EnumMap<>(SyncEntityType.class);

    public SyncStreamContext(
            UUID userId,
            UUID sessionId,
            CheckpointMap checkpoints,
            VersionToken nowId,
            int pageSize,
            SyncStreamSink sink) {
        this.userId = userId;
        this.sessionId = sessionId;
        this.checkpoints = checkpoints;
        this.nowId = nowId;
        this.pageSize = pageSize;
        this.sink = sink;
    }

    public UUID userId() {
        return userId;
    }

    public UUID sessionId() {
        return sessionId;
    }

    public CheckpointMap checkpoints() {
        return checkpoints;
    }

    /** Exclusive upper bound of every read in this stream open; also the token of the completion marker. */
    public VersionToken nowId() {
        return nowId;
    }

    public int pageSize() {
        return pageSize;
    }

    public FeedQuery query(UUID relationId, VersionToken after, VersionToken ceiling) {
        return new FeedQuery(userId, relationId, after, ceiling, nowId, pageSize);
    }

    public void send(SyncEntityType type, SyncPayload data, SyncAck ack) throws IOException {
        sink.send(SyncStreamLine.of(type, data, ack));
        sent.merge(type, 1, Integer::sum);
    }

    public Map<SyncEntityType, Integer> sentCounts() {
        return Map.copyOf(sent);
    }

    public int totalSent() {
        return sent.values().stream().mapToInt(Integer::intValue).sum();
    }
}
