package com.syncline.service.core.checkpoint;

import com.syncline.service.core.model.SyncAck;
import com.syncline.service.core.model.SyncEntityType;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/** Durable (session, type) to ack mapping. */
public interface SyncCheckpointStore {

    List<SyncCheckpoint> findBySession(UUID sessionId);

    /**
     * Atomically applies a batch: for each type the stored ack becomes the greater of the stored and the
     * proposed ack ({@link SyncAck#PROGRESS}). Either every type of the batch lands or none does.
     *
     * @return number of types whose stored ack moved forward
     */
    int advance(UUID sessionId, Collection<SyncAck> acks);

    int deleteAll(UUID sessionId);

    int deleteTypes(UUID sessionId, Collection<SyncEntityType> types);
}
