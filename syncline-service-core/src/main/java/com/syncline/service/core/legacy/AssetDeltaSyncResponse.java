package com.syncline.service.core.legacy;

import java.util.List;

public record AssetDeltaSyncResponse(boolean needsFullSync, List<AssetResponse> upserted, List<String> deleted) {

    public static AssetDeltaSyncResponse fullSyncRequired() {
        return new AssetDeltaSyncResponse(true, List.of(), List.of());
    }
}
