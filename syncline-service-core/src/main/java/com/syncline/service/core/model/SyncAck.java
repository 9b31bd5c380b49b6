package com.syncline.service.core.model;

import com.syncline.service.core.error.CursorInvalidException;
import java.util.Comparator;
import java.util.Objects;

/**
 * Decoded cursor of one wire type: {@code type|updateId|extraId}.
 *
 * <p>For backfill types {@code updateId} is the create token of the relationship being backfilled and
 * {@code extraId} the last row token sent for it, or {@link #COMPLETE} once that relationship is done.
 */
public record SyncAck(SyncEntityType type, String updateId, String extraId) {

    public static final String COMPLETE = "complete";
    public static final String RESET = "reset";

    private static final String SEPARATOR = "|";

    /** Orders acks of the same type: by update id, then absent extra id, then tokens, then complete. */
    public static final Comparator<SyncAck> PROGRESS = Comparator.comparing(SyncAck::updateId)
            .thenComparing(SyncAck::extraRank)
            .thenComparing(a -> a.extraId() == null ? "" : a.extraId());

    public SyncAck {
        Objects.requireNonNull(type, "type");
        if (updateId == null || updateId.isBlank()) {
            throw new CursorInvalidException("Ack for " + type + " has no update id");
        }
        if (extraId != null && extraId.isBlank()) {
            extraId = null;
        }
    }

    public static SyncAck of(SyncEntityType type, VersionToken token) {
        return new SyncAck(type, token.value(), null);
    }

    public static SyncAck parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new CursorInvalidException("Empty ack");
        }
        String[] parts = raw.split("\\|", -1);
        if (parts.length < 2 || parts.length > 3) {
            throw new CursorInvalidException("Malformed ack: " + raw);
        }
        SyncEntityType type = SyncEntityType.fromName(parts[0])
                .orElseThrow(() -> new CursorInvalidException("Unknown ack type: " + parts[0]));
        String extra = parts.length > 2 ? parts[2] : null;
        return new SyncAck(type, parts[1], extra);
    }

    /** Token view of {@link #updateId()}; only valid for types whose update id is a version token. */
    public VersionToken token() {
        return VersionToken.parse(updateId);
    }

    /** Token view of {@link #extraId()}, or null when absent or {@link #COMPLETE}. */
    public VersionToken extraToken() {
        return extraId == null || isComplete() ? null : VersionToken.parse(extraId);
    }

    public boolean isComplete() {
        return COMPLETE.equals(extraId);
    }

    public boolean isAfter(SyncAck other) {
        return other == null || PROGRESS.compare(this, other) > 0;
    }

    /** Validates the token parts for the type so malformed cursors are rejected at ack time. */
    public SyncAck validated() {
        if (type == SyncEntityType.SyncResetV1) {
            return this;
        }
        token();
        extraToken();
        return this;
    }

    public String encode() {
        return extraId == null
                ? type.name() + SEPARATOR + updateId
                : type.name() + SEPARATOR + updateId + SEPARATOR + extraId;
    }

    private int extraRank() {
        if (extraId == null) {
            return 0;
        }
        return isComplete() ? 2 : 1;
    }

    @Override
    public String toString() {
        return encode();
    }
}
