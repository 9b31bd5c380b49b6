package com.syncline.controller.rest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncline.api.dto.AssetDeltaSyncDto;
import com.syncline.api.dto.AssetFullSyncDto;
import com.syncline.api.dto.SyncAckDeleteDto;
import com.syncline.api.dto.SyncAckSetDto;
import com.syncline.api.dto.SyncStreamDto;
import com.syncline.service.core.ack.SyncAckService;
import com.syncline.service.core.ack.SyncAckView;
import com.syncline.service.core.ack.SyncResetService;
import com.syncline.service.core.legacy.AssetDeltaSyncRequest;
import com.syncline.service.core.legacy.AssetDeltaSyncResponse;
import com.syncline.service.core.legacy.AssetFullSyncRequest;
import com.syncline.service.core.legacy.AssetResponse;
import com.syncline.service.core.legacy.LegacyAssetSyncService;
import com.syncline.service.core.model.SyncAuth;
import com.syncline.service.core.stream.SyncStreamOutcome;
import com.syncline.service.core.stream.SyncStreamRequest;
import com.syncline.service.core.stream.SyncStreamService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/**
 * Sync endpoints. The caller is identified by headers set by the authentication layer in front of the
 * service: {@code X-User-Id} always, {@code X-Session-Id} for session logins (absent for API keys).
 */
@RestController
@RequestMapping("/api/sync")
public class SyncController {

    public static final String USER_HEADER = "X-User-Id";
    public static final String SESSION_HEADER = "X-Session-Id";
    public static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private static final Logger log = LoggerFactory.getLogger(SyncController.class);
    private static final int FLUSH_EVERY = 100;

    private final SyncStreamService streamService;
    private final SyncAckService ackService;
    private final SyncResetService resetService;
    private final LegacyAssetSyncService legacyService;
    private final ObjectMapper mapper;

    public SyncController(
            SyncStreamService streamService,
            SyncAckService ackService,
            SyncResetService resetService,
            LegacyAssetSyncService legacyService,
            ObjectMapper mapper) {
        this.streamService = streamService;
        this.ackService = ackService;
        this.resetService = resetService;
        this.legacyService = legacyService;
        this.mapper = mapper;
    }

    @PostMapping("/stream")
    public ResponseEntity<StreamingResponseBody> stream(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestHeader(value = SESSION_HEADER, required = false) UUID sessionId,
            @Valid @RequestBody SyncStreamDto body) {
        SyncAuth auth = new SyncAuth(userId, sessionId);
        // rejected before the response is committed
        auth.requireSessionId();
        SyncStreamRequest request = SyncStreamRequest.of(body.getTypes(), Boolean.TRUE.equals(body.getReset()));

        StreamingResponseBody stream = out -> {
            NdjsonStreamSink sink = new NdjsonStreamSink(mapper, out, FLUSH_EVERY);
            SyncStreamOutcome outcome = streamService.stream(auth, request, sink);
            sink.flush();
            if (log.isDebugEnabled()) {
                log.debug("Stream for session {} ended with {}", sessionId, outcome);
            }
        };
        return ResponseEntity.ok().contentType(NDJSON).body(stream);
    }

    @GetMapping("/ack")
    public List<SyncAckView> getAcks(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestHeader(value = SESSION_HEADER, required = false) UUID sessionId) {
        return ackService.getAcks(new SyncAuth(userId, sessionId));
    }

    @PostMapping("/ack")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void setAcks(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestHeader(value = SESSION_HEADER, required = false) UUID sessionId,
            @Valid @RequestBody SyncAckSetDto body) {
        ackService.setAcks(new SyncAuth(userId, sessionId), body.getAcks());
    }

    @DeleteMapping("/ack")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteAcks(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestHeader(value = SESSION_HEADER, required = false) UUID sessionId,
            @RequestBody(required = false) SyncAckDeleteDto body) {
        resetService.reset(new SyncAuth(userId, sessionId), body == null ? null : body.getTypes());
    }

    @PostMapping("/full-sync")
    public List<AssetResponse> fullSync(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestHeader(value = SESSION_HEADER, required = false) UUID sessionId,
            @Valid @RequestBody AssetFullSyncDto body) {
        return legacyService.getFullSync(
                new SyncAuth(userId, sessionId),
                new AssetFullSyncRequest(body.getLastId(), body.getUpdatedUntil(), body.getLimit(), body.getUserId()));
    }

    @PostMapping("/delta-sync")
    public AssetDeltaSyncResponse deltaSync(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestHeader(value = SESSION_HEADER, required = false) UUID sessionId,
            @Valid @RequestBody AssetDeltaSyncDto body) {
        return legacyService.getDeltaSync(
                new SyncAuth(userId, sessionId), new AssetDeltaSyncRequest(body.getUpdatedAfter(), body.getUserIds()));
    }
}
