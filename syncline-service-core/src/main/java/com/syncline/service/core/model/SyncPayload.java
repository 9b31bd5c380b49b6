package com.syncline.service.core.model;

/** Marker for the data carried by one stream line; each {@link SyncEntityType} names exactly one variant. */
public interface SyncPayload {}
