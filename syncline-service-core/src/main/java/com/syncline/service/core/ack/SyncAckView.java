package com.syncline.service.core.ack;

/** Stored checkpoint as returned to clients. */
public record SyncAckView(String type, String ack) {}
