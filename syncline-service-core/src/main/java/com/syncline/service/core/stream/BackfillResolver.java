package com.syncline.service.core.stream;

import com.syncline.service.core.checkpoint.SyncCheckpointStore;
import com.syncline.service.core.feed.FeedQuery;
import com.syncline.service.core.feed.GrantKind;
import com.syncline.service.core.feed.RelationshipGrant;
import com.syncline.service.core.feed.SyncFeed;
import com.syncline.service.core.feed.SyncFeedRepository;
import com.syncline.service.core.feed.SyncRow;
import com.syncline.service.core.model.SyncAck;
import com.syncline.service.core.model.SyncEntityType;
import com.syncline.service.core.model.SyncPayload;
import com.syncline.service.core.model.SyncPayloads.SyncEmptyV1;
import com.syncline.service.core.model.VersionToken;
import java.io.IOException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Sends the history of relationships granted after a session's live feed had already moved past it.
 *
 * <p>When a partner starts sharing, or the user joins an album, the shared rows keep their old tokens and
 * sit below the live checkpoint. For every such grant the resolver replays rows whose token lies in
 * {@code (start, ceiling]}, where ceiling is the checkpoint of the live type. The backfill checkpoint is
 * {@code createId|lastRowToken} while a grant is in progress and {@code createId|complete} once done.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BackfillResolver {
    private final SyncFeedRepository feeds;
    private final SyncCheckpointStore checkpoints;

    /**
     * @param backfillType wire type of the replayed rows, also the checkpoint of backfill progress
     * @param ceilingType live type whose checkpoint bounds what needs replaying
     * @return number of lines sent
     */
    public <P extends SyncPayload> int resolve(
            SyncStreamContext ctx,
            GrantKind kind,
            SyncEntityType backfillType,
            SyncEntityType ceilingType,
            SyncFeed<P> feed)
            throws IOException {
        SyncAck progress = ctx.checkpoints().get(backfillType);
        VersionToken fromCreateId = progress == null ? null : progress.token();
        List<RelationshipGrant> grants = feeds.grantsSince(kind, ctx.userId(), fromCreateId);
        if (grants.isEmpty()) {
            return 0;
        }

        VersionToken ceiling = ctx.checkpoints().token(ceilingType);
        if (ceiling == null) {
            // live feed has not started, it will deliver everything these grants expose
            RelationshipGrant last = grants.get(grants.size() - 1);
            SyncAck done = new SyncAck(backfillType, last.createId().value(), SyncAck.COMPLETE);
            if (done.isAfter(progress)) {
                checkpoints.advance(ctx.sessionId(), List.of(done));
                ctx.checkpoints().put(done);
                log.debug("Session {} skipped {} backfill up to {}", ctx.sessionId(), backfillType, done);
            }
            return 0;
        }

        int sent = 0;
        for (RelationshipGrant grant : grants) {
            VersionToken start = null;
            if (progress != null && progress.token().equals(grant.createId())) {
                if (progress.isComplete()) {
                    continue;
                }
                start = progress.extraToken();
            }
            sent += replay(ctx, grant, backfillType, feed, start, ceiling);
            ctx.send(
                    SyncEntityType.SyncAckV1,
                    SyncEmptyV1.INSTANCE,
                    new SyncAck(backfillType, grant.createId().value(), SyncAck.COMPLETE));
            sent++;
        }
        return sent;
    }

    private <P extends SyncPayload> int replay(
            SyncStreamContext ctx,
            RelationshipGrant grant,
            SyncEntityType backfillType,
            SyncFeed<P> feed,
            VersionToken start,
            VersionToken ceiling)
            throws IOException {
        FeedQuery query = ctx.query(grant.relationId(), start, ceiling);
        int sent = 0;
        while (true) {
            List<SyncRow<P>> page = feeds.read(feed, query);
            for (SyncRow<P> row : page) {
                ctx.send(
                        backfillType,
                        row.payload(),
                        new SyncAck(backfillType, grant.createId().value(), row.token().value()));
                sent++;
            }
            if (page.size() < query.limit()) {
                return sent;
            }
            query = query.withAfter(page.get(page.size() - 1).token());
        }
    }
}
