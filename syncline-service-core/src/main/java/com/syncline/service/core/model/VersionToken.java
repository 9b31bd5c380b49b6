package com.syncline.service.core.model;

import com.syncline.service.core.error.CursorInvalidException;
import java.time.Instant;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Time-ordered version stamp carried by every syncable row and every tombstone.
 *
 * <p>Tokens use the UUID version 7 layout in canonical lower-case form, so lexical order of the string
 * equals issue order and the leading 48 bits hold the issue time in epoch milliseconds.
 */
public record VersionToken(String value) implements Comparable<VersionToken> {

    private static final Pattern FORMAT =
            Pattern.compile("^[0-9a-f]{8}-[0-9a-f]{4}-7[0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}$");

    public VersionToken {
        if (value == null || !FORMAT.matcher(value).matches()) {
            throw new CursorInvalidException("Unrecognised version token: " + value);
        }
    }

    public static VersionToken parse(String raw) {
        if (raw == null) {
            throw new CursorInvalidException("Missing version token");
        }
        return new VersionToken(raw.trim().toLowerCase(Locale.ROOT));
    }

    /** Returns null for null/blank input instead of failing. */
    public static VersionToken parseNullable(String raw) {
        return raw == null || raw.isBlank() ? null : parse(raw);
    }

    public static boolean isValid(String raw) {
        return raw != null && FORMAT.matcher(raw).matches();
    }

    public Instant timestamp() {
        long millis = Long.parseLong(value.substring(0, 8) + value.substring(9, 13), 16);
        return Instant.ofEpochMilli(millis);
    }

    public boolean isAfter(VersionToken other) {
        return other == null || compareTo(other) > 0;
    }

    @Override
    public int compareTo(VersionToken other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
