package com.syncline.service.core.checkpoint;

import java.time.Instant;
import java.util.UUID;

/**
 * Stored progress row. {@code type} stays a raw string: rows written by an older protocol version may
 * name types this server no longer knows.
 */
public record SyncCheckpoint(UUID sessionId, String type, String ack, Instant updatedAt) {}
