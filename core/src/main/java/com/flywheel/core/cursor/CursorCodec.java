package com.flywheel.core.cursor;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Stateless encoding of replay cursors.
 * <p>
 * <b>Wire format:</b> {@code base64url("<timestampMs>:<sequence>")} without padding,
 * so a cursor can travel in URLs, headers and JSON unchanged.
 * </p>
 * <p>
 * Decoding never throws: malformed base64, a wrong segment count, non-numeric or
 * negative segments all decode to {@link Optional#empty()}.
 * </p>
 */
public final class CursorCodec {
    private static final String DELIMITER = ":";

    private CursorCodec() {
    }

    /**
     * Encodes cursor data into its opaque string form.
     *
     * @param data Cursor position
     * @return URL-safe cursor token
     */
    public static String encode(CursorData data) {
        String raw = data.getTimestamp() + DELIMITER + data.getSequence();
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Decodes a cursor token.
     *
     * @param cursor Cursor token, may be null
     * @return Decoded position, or empty if the token is not a valid cursor
     */
    public static Optional<CursorData> decode(String cursor) {
        if (cursor == null || cursor.isEmpty()) {
            return Optional.empty();
        }
        try {
            String decoded = new String(Base64.getUrlDecoder().decode(cursor), StandardCharsets.UTF_8);
            String[] parts = decoded.split(DELIMITER, -1);
            if (parts.length != 2) {
                return Optional.empty();
            }

            long timestamp = parseNonNegative(parts[0]);
            long sequence = parseNonNegative(parts[1]);
            if (timestamp < 0 || sequence < 0) {
                return Optional.empty();
            }
            return Optional.of(new CursorData(timestamp, sequence));
        } catch (IllegalArgumentException e) {
            // Bad base64 alphabet or padding
            return Optional.empty();
        }
    }

    /**
     * Compares two cursor tokens by timestamp, then sequence.
     *
     * @return -1, 0 or 1; empty if either token is invalid
     */
    public static OptionalInt compare(String a, String b) {
        Optional<CursorData> left = decode(a);
        Optional<CursorData> right = decode(b);
        if (left.isEmpty() || right.isEmpty()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Integer.signum(left.get().compareTo(right.get())));
    }

    /**
     * Checks whether a cursor is older than the given TTL.
     * <p>
     * A cursor exactly at the TTL boundary is not yet expired.
     * </p>
     *
     * @param cursor Cursor token
     * @param ttlMs  Time-to-live in milliseconds
     * @param nowMs  Current time (epoch millis)
     * @return Expiry flag, or empty if the token is invalid
     */
    public static Optional<Boolean> isExpired(String cursor, long ttlMs, long nowMs) {
        return decode(cursor).map(data -> nowMs - data.getTimestamp() > ttlMs);
    }

    public static Optional<Boolean> isExpired(String cursor, long ttlMs) {
        return isExpired(cursor, ttlMs, System.currentTimeMillis());
    }

    /**
     * Creates a cursor token for the given sequence at the given time.
     */
    public static String create(long sequence, long timestamp) {
        return encode(new CursorData(timestamp, sequence));
    }

    public static String create(long sequence) {
        return create(sequence, System.currentTimeMillis());
    }

    /**
     * Strict decimal parse: digits only, so "+5", " 5" and "-5" are rejected.
     */
    private static long parseNonNegative(String segment) {
        if (segment.isEmpty()) {
            return -1;
        }
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
        }
        try {
            return Long.parseLong(segment);
        } catch (NumberFormatException e) {
            // Overflows long
            return -1;
        }
    }
}
