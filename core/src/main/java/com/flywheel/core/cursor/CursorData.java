package com.flywheel.core.cursor;

import lombok.Value;

/**
 * Decoded position of an event within a channel.
 * <p>
 * Ordering is lexicographic on {@code (timestamp, sequence)}.
 * </p>
 */
@Value
public class CursorData implements Comparable<CursorData> {
    /**
     * Wall-clock time the event was buffered (epoch millis).
     */
    long timestamp;

    /**
     * Monotonic sequence assigned by the issuing buffer.
     */
    long sequence;

    @Override
    public int compareTo(CursorData other) {
        int byTime = Long.compare(timestamp, other.timestamp);
        return byTime != 0 ? byTime : Long.compare(sequence, other.sequence);
    }
}
