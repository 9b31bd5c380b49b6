package com.syncline.service.core.stream;

import com.syncline.service.core.model.SyncStreamLine;
import java.io.IOException;

/** Destination of a stream. An {@link IOException} means the client went away. */
@FunctionalInterface
public interface SyncStreamSink {
    void send(SyncStreamLine line) throws IOException;
}
