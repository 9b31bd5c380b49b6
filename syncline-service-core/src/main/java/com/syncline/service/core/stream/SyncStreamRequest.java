package com.syncline.service.core.stream;

import com.syncline.service.core.error.SyncProtocolException;
import com.syncline.service.core.error.SyncProtocolException.RejectedItem;
import com.syncline.service.core.model.SyncRequestType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/** Groups requested on stream open; iteration order of {@code types} is delivery order. */
public record SyncStreamRequest(Set<SyncRequestType> types, boolean reset) {

    public SyncStreamRequest {
        if (types == null || types.isEmpty()) {
            throw new SyncProtocolException("At least one sync type is required");
        }
        types = EnumSet.copyOf(types);
    }

    /** Resolves request-group names, rejecting every unknown one in a single error. */
    public static SyncStreamRequest of(Collection<String> names, boolean reset) {
        if (names == null || names.isEmpty()) {
            throw new SyncProtocolException("At least one sync type is required");
        }
        Set<SyncRequestType> types = EnumSet.noneOf(SyncRequestType.class);
        List<RejectedItem> rejected = new ArrayList<>();
        for (String name : names) {
            SyncRequestType.fromName(name)
                    .ifPresentOrElse(types::add, () -> rejected.add(new RejectedItem(name, "unknown sync type")));
        }
        if (!rejected.isEmpty()) {
            throw new SyncProtocolException("Unknown sync types requested", rejected);
        }
        return new SyncStreamRequest(types, reset);
    }
}
