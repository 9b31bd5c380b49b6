package com.syncline.service.core.stream;

import com.syncline.service.core.ack.SyncResetService;
import com.syncline.service.core.checkpoint.CheckpointMap;
import com.syncline.service.core.checkpoint.SyncCheckpointStore;
import com.syncline.service.core.checkpoint.SyncSessionStore;
import com.syncline.service.core.config.SyncProperties;
import com.syncline.service.core.error.CursorInvalidException;
import com.syncline.service.core.error.CursorTooOldException;
import com.syncline.service.core.model.SyncAuth;
import com.syncline.service.core.model.SyncEntityType;
import com.syncline.service.core.model.SyncRequestType;
import com.syncline.service.core.model.SyncStreamLine;
import com.syncline.service.core.model.VersionClock;
import com.syncline.service.core.model.VersionToken;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs one stream open for a session: checks whether the client must reset, then drains every requested
 * group up to a fixed {@code nowId} and finishes with {@code SyncCompleteV1}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncStreamService {
    private final SyncCheckpointStore checkpointStore;
    private final SyncSessionStore sessionStore;
    private final SyncResetService resetService;
    private final SyncHandlerCatalog catalog;
    private final VersionClock versionClock;
    private final SyncProperties properties;
    private final Clock clock;

    public SyncStreamOutcome stream(SyncAuth auth, SyncStreamRequest request, SyncStreamSink sink)
            throws IOException {
        UUID sessionId = auth.requireSessionId();
        if (request.reset()) {
            resetService.resetAll(sessionId);
        }

        if (sessionStore.isPendingSyncReset(sessionId)) {
            log.info("Session {} has a pending reset", sessionId);
            return sendReset(sink);
        }

        CheckpointMap checkpoints;
        try {
            checkpoints = CheckpointMap.of(checkpointStore.findBySession(sessionId));
        } catch (CursorInvalidException e) {
            log.warn("Session {} holds an unreadable checkpoint: {}", sessionId, e.getMessage());
            return sendReset(sink);
        }

        VersionToken completed = checkpoints.token(SyncEntityType.SyncCompleteV1);
        Instant horizon = clock.instant().minus(properties.getTombstoneRetention());
        if (completed != null && completed.timestamp().isBefore(horizon)) {
            log.info("Session {} last completed at {}, before horizon {}", sessionId, completed.timestamp(), horizon);
            return sendReset(sink);
        }

        // acks are only accepted for groups recorded here
        sessionStore.addStreamedGroups(sessionId, request.types());
        VersionToken nowId = versionClock.next();
        SyncStreamContext ctx =
                new SyncStreamContext(auth.userId(), sessionId, checkpoints, nowId, properties.getPageSize(), sink);
        try {
            for (SyncRequestType type : request.types()) {
                catalog.handler(type).stream(ctx);
            }
        } catch (CursorTooOldException e) {
            log.info("Session {} must reset: {}", sessionId, e.getMessage());
            return sendReset(sink);
        }

        sink.send(SyncStreamLine.complete(nowId));
        log.debug("Session {} streamed {} lines up to {}: {}", sessionId, ctx.totalSent(), nowId, ctx.sentCounts());
        return SyncStreamOutcome.COMPLETE;
    }

    private static SyncStreamOutcome sendReset(SyncStreamSink sink) throws IOException {
        sink.send(SyncStreamLine.reset());
        return SyncStreamOutcome.RESET;
    }
}
