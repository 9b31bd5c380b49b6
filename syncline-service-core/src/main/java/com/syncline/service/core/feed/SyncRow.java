package com.syncline.service.core.feed;

import com.syncline.service.core.model.SyncPayload;
import com.syncline.service.core.model.VersionToken;

public record SyncRow<P extends SyncPayload>(VersionToken token, P payload) {}
