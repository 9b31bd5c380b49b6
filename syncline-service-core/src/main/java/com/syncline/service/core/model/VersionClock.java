package com.syncline.service.core.model;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Issues strictly increasing {@link VersionToken}s.
 *
 * <p>Tokens issued within the same millisecond (or while the wall clock steps backwards) keep the last
 * timestamp and bump the 12-bit sequence field; when the sequence wraps the timestamp is advanced by one
 * millisecond.
 */
public class VersionClock {

    private static final int MAX_SEQUENCE = 0xFFF;

    private final Clock clock;
    private long lastMillis = -1L;
    private int sequence;

    public VersionClock(Clock clock) {
        this.clock = clock;
    }

    public synchronized VersionToken next() {
        long now = clock.millis();
        if (now > lastMillis) {
            lastMillis = now;
            sequence = 0;
        } else if (sequence < MAX_SEQUENCE) {
            sequence++;
        } else {
            lastMillis++;
            sequence = 0;
        }
        return new VersionToken(format(lastMillis, sequence, ThreadLocalRandom.current().nextLong()));
    }

    static String format(long millis, int sequence, long random) {
        long msb = (millis << 16) | 0x7000L | (sequence & MAX_SEQUENCE);
        long lsb = (random & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;
        String hex = String.format("%016x%016x", msb, lsb);
        return hex.substring(0, 8)
                + '-'
                + hex.substring(8, 12)
                + '-'
                + hex.substring(12, 16)
                + '-'
                + hex.substring(16, 20)
                + '-'
                + hex.substring(20);
    }
}
