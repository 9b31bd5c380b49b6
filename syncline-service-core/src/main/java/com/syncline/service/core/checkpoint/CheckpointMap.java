package com.syncline.service.core.checkpoint;

import com.syncline.service.core.error.CursorInvalidException;
import com.syncline.service.core.model.SyncAck;
import com.syncline.service.core.model.SyncEntityType;
import com.syncline.service.core.model.VersionToken;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/** Parsed checkpoints of one session, keyed by wire type. */
public final class CheckpointMap {
    private final Map<SyncEntityType, SyncAck> acks;

    private CheckpointMap(Map<SyncEntityType, SyncAck> acks) {
        this.acks = acks;
    }

    public static CheckpointMap empty() {
        return new CheckpointMap(new EnumMap<>(SyncEntityType.class));
    }

    /**
     * @throws CursorInvalidException if a stored row names an unknown type, disagrees with its own type
     *     column, or carries a malformed token
     */
    public static CheckpointMap of(Collection<SyncCheckpoint> checkpoints) {
        Map<SyncEntityType, SyncAck> acks = new EnumMap<>(SyncEntityType.class);
        for (SyncCheckpoint checkpoint : checkpoints) {
            SyncAck ack = SyncAck.parse(checkpoint.ack()).validated();
            if (!ack.type().name().equals(checkpoint.type())) {
                throw new CursorInvalidException(
                        "Checkpoint " + checkpoint.type() + " holds an ack for " + ack.type());
            }
            acks.put(ack.type(), ack);
        }
        return new CheckpointMap(acks);
    }

    public SyncAck get(SyncEntityType type) {
        return acks.get(type);
    }

    public boolean contains(SyncEntityType type) {
        return acks.containsKey(type);
    }

    /** Update token of the type's checkpoint, or null when the type was never acked. */
    public VersionToken token(SyncEntityType type) {
        SyncAck ack = acks.get(type);
        return ack == null ? null : ack.token();
    }

    /** Records server-side progress made during the current stream open. */
    public void put(SyncAck ack) {
        acks.put(ack.type(), ack);
    }

    public boolean isEmpty() {
        return acks.isEmpty();
    }
}
