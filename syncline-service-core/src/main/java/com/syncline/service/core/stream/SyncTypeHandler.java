package com.syncline.service.core.stream;

import java.io.IOException;

/** Streams everything one request group has for the context's session. */
@FunctionalInterface
public interface SyncTypeHandler {
    void stream(SyncStreamContext ctx) throws IOException;
}
