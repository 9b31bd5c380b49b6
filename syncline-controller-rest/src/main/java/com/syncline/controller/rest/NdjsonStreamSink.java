package com.syncline.controller.rest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncline.service.core.model.SyncStreamLine;
import com.syncline.service.core.stream.SyncStreamSink;
import java.io.IOException;
import java.io.OutputStream;

/** Writes one JSON document per line, flushing every {@code flushEvery} lines. */
class NdjsonStreamSink implements SyncStreamSink {
    private static final byte NEWLINE = '\n';

    private final ObjectMapper mapper;
    private final OutputStream out;
    private final int flushEvery;
    private int pending;

    NdjsonStreamSink(ObjectMapper mapper, OutputStream out, int flushEvery) {
        this.mapper = mapper;
        this.out = out;
        this.flushEvery = flushEvery;
    }

    @Override
    public void send(SyncStreamLine line) throws IOException {
        out.write(mapper.writeValueAsBytes(line));
        out.write(NEWLINE);
        if (++pending >= flushEvery) {
            flush();
        }
    }

    void flush() throws IOException {
        out.flush();
        pending = 0;
    }
}
