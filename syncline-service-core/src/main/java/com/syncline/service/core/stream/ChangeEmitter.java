package com.syncline.service.core.stream;

import com.syncline.service.core.checkpoint.CheckpointMap;
import com.syncline.service.core.config.SyncProperties;
import com.syncline.service.core.error.CursorTooOldException;
import com.syncline.service.core.feed.SyncFeedRepository;
import com.syncline.service.core.feed.SyncRow;
import com.syncline.service.core.model.SyncAck;
import com.syncline.service.core.model.SyncEntityType;
import com.syncline.service.core.model.SyncPayload;
import com.syncline.service.core.model.VersionToken;
import com.syncline.service.core.tombstone.Tombstone;
import com.syncline.service.core.tombstone.TombstoneLog;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Drains a set of change sources into the stream. Sources are merged by ascending token, each resumes
 * strictly after its own checkpoint and stops before the stream's {@code nowId}. Reads are paged so a
 * large backlog never sits in memory at once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChangeEmitter {
    private final SyncFeedRepository feeds;
    private final TombstoneLog tombstones;
    private final SyncProperties properties;
    private final Clock clock;

    /**
     * @return number of lines sent
     * @throws CursorTooOldException if a delete source resumes from before the tombstone horizon
     */
    public int drain(SyncStreamContext ctx, ChangeSource... sources) throws IOException {
        List<SyncEntityType> types = new ArrayList<>();
        for (ChangeSource source : sources) {
            types.add(source.type());
        }
        for (ChangeSource source : sources) {
            if (source instanceof ChangeSource.Deletes) {
                requireFresh(ctx.checkpoints(), source.type(), types);
            }
        }

        List<Cursor> cursors = new ArrayList<>(sources.length);
        for (ChangeSource source : sources) {
            cursors.add(new Cursor(source, ctx.checkpoints().token(source.type())));
        }

        int sent = 0;
        while (true) {
            Cursor next = null;
            for (Cursor cursor : cursors) {
                if (cursor.buffer.isEmpty() && !cursor.exhausted) {
                    cursor.fill(ctx);
                }
                SyncRow<? extends SyncPayload> head = cursor.buffer.peek();
                if (head != null && (next == null || head.token().compareTo(next.buffer.peek().token()) < 0)) {
                    next = cursor;
                }
            }
            if (next == null) {
                return sent;
            }
            SyncRow<? extends SyncPayload> row = next.buffer.poll();
            SyncEntityType type = next.source.type();
            ctx.send(type, row.payload(), SyncAck.of(type, row.token()));
            sent++;
        }
    }

    /**
     * A session that already holds state for these types must have seen the delete feed (or completed a
     * stream) after the horizon; otherwise purged tombstones would go unnoticed.
     */
    void requireFresh(CheckpointMap checkpoints, SyncEntityType deleteType, List<SyncEntityType> related) {
        boolean holdsState = related.stream().anyMatch(checkpoints::contains);
        if (!holdsState) {
            return;
        }
        Instant freshness = latest(
                checkpoints.token(deleteType), checkpoints.token(SyncEntityType.SyncCompleteV1));
        if (freshness == null) {
            for (SyncEntityType type : related) {
                freshness = latest(freshness, checkpoints.token(type));
            }
        }
        Instant horizon = clock.instant().minus(properties.getTombstoneRetention());
        if (freshness != null && freshness.isBefore(horizon)) {
            log.info("Cursor for {} at {} predates tombstone horizon {}", deleteType, freshness, horizon);
            throw new CursorTooOldException(deleteType, freshness, horizon);
        }
    }

    private static Instant latest(VersionToken a, VersionToken b) {
        return latest(a == null ? null : a.timestamp(), b);
    }

    private static Instant latest(Instant current, VersionToken token) {
        if (token == null) {
            return current;
        }
        Instant candidate = token.timestamp();
        return current == null || candidate.isAfter(current) ? candidate : current;
    }

    private List<SyncRow<? extends SyncPayload>> read(
            ChangeSource source, SyncStreamContext ctx, VersionToken after) {
        if (source instanceof ChangeSource.Rows<?> rows) {
            return new ArrayList<>(feeds.read(rows.feed(), ctx.query(null, after, rows.ceiling())));
        }
        ChangeSource.Deletes deletes = (ChangeSource.Deletes) source;
        List<SyncRow<? extends SyncPayload>> out = new ArrayList<>();
        for (Tombstone tombstone : tombstones.read(deletes.kind(), deletes.scope(), ctx.query(null, after, null))) {
            out.add(new SyncRow<>(tombstone.id(), deletes.mapper().apply(tombstone)));
        }
        return out;
    }

    private final class Cursor {
        private final ChangeSource source;
        private final Deque<SyncRow<? extends SyncPayload>> buffer = new ArrayDeque<>();
        private VersionToken after;
        private boolean exhausted;

        private Cursor(ChangeSource source, VersionToken after) {
            this.source = source;
            this.after = after;
        }

        private void fill(SyncStreamContext ctx) {
            List<SyncRow<? extends SyncPayload>> page = read(source, ctx, after);
            if (page.size() < ctx.pageSize()) {
                exhausted = true;
            }
            if (!page.isEmpty()) {
                after = page.get(page.size() - 1).token();
                buffer.addAll(page);
            } else {
                exhausted = true;
            }
        }
    }
}
