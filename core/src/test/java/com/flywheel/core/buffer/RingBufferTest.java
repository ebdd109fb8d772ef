package com.flywheel.core.buffer;

import com.flywheel.core.MutableClock;
import com.flywheel.core.cursor.CursorCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RingBufferTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_000_000L);
    }

    private RingBuffer<String> buffer(int capacity, long ttlMs) {
        return new RingBuffer<>(RingBufferConfig.builder().capacity(capacity).ttlMs(ttlMs).build(), clock);
    }

    @Test
    @DisplayName("Capacity below one is rejected")
    void testInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> buffer(0, 1000));
    }

    @Test
    @DisplayName("Pushing past capacity evicts the oldest entry and invalidates its cursor")
    void testCapacityEviction() {
        // Given: a buffer of 3
        RingBuffer<String> buffer = buffer(3, 0);
        List<String> cursors = new ArrayList<>();
        for (String item : List.of("a", "b", "c", "d")) {
            cursors.add(buffer.push(item));
        }

        // Then: "a" is gone
        assertEquals(3, buffer.size());
        assertEquals(List.of("b", "c", "d"), buffer.getAll());
        assertFalse(buffer.isValidCursor(cursors.get(0)));
        assertTrue(buffer.get(cursors.get(0)).isEmpty());
        assertEquals(Optional.of("b"), buffer.get(cursors.get(1)));
        assertEquals(Optional.of(cursors.get(1)), buffer.getOldestCursor());
        assertEquals(Optional.of(cursors.get(3)), buffer.getLatestCursor());
    }

    @Test
    @DisplayName("Sequences increase by one per push starting at zero")
    void testSequenceAssignment() {
        RingBuffer<String> buffer = buffer(10, 0);

        for (int i = 0; i < 5; i++) {
            String cursor = buffer.push("item-" + i);
            assertEquals(i, CursorCodec.decode(cursor).orElseThrow().getSequence());
        }
    }

    @Test
    @DisplayName("Slice returns items strictly after the cursor, honoring the limit")
    void testSlice() {
        RingBuffer<String> buffer = buffer(10, 0);
        String first = buffer.push("a");
        buffer.push("b");
        buffer.push("c");
        buffer.push("d");

        assertEquals(List.of("b", "c", "d"), buffer.slice(first));
        assertEquals(List.of("b", "c"), buffer.slice(first, 2));
        assertEquals(List.of(), buffer.slice("garbage"));
        assertEquals(List.of("a", "b"), buffer.getAll(2));
    }

    @Test
    @DisplayName("A limit below one yields no items")
    void testNonPositiveLimit() {
        RingBuffer<String> buffer = buffer(10, 0);
        String first = buffer.push("a");
        buffer.push("b");

        assertEquals(List.of(), buffer.getAll(0));
        assertEquals(List.of(), buffer.getAll(-1));
        assertEquals(List.of(), buffer.slice(first, 0));
        assertEquals(List.of("b"), buffer.slice(first, 1));
    }

    @Test
    @DisplayName("Entries older than the TTL are hidden before prune and removed by it")
    void testTtlExpiry() {
        // Given: two old entries and one fresh entry
        RingBuffer<String> buffer = buffer(10, 1000);
        String old = buffer.push("old-1");
        buffer.push("old-2");
        clock.advance(600);
        String fresh = buffer.push("fresh");

        // When: the old ones pass their TTL
        clock.advance(401);

        // Then: reads skip them while they still occupy slots
        assertEquals(List.of("fresh"), buffer.getAll());
        assertFalse(buffer.isValidCursor(old));
        assertTrue(buffer.isValidCursor(fresh));
        assertEquals(3, buffer.size());
        assertEquals(1, buffer.validSize());

        assertEquals(2, buffer.prune());
        assertEquals(1, buffer.size());
    }

    @Test
    @DisplayName("An entry exactly at its TTL is still live")
    void testTtlBoundary() {
        RingBuffer<String> buffer = buffer(10, 1000);
        String cursor = buffer.push("a");

        clock.advance(1000);
        assertTrue(buffer.isValidCursor(cursor));

        clock.advance(1);
        assertFalse(buffer.isValidCursor(cursor));
    }

    @Test
    @DisplayName("TTL zero disables time-based expiry")
    void testTtlDisabled() {
        RingBuffer<String> buffer = buffer(10, 0);
        buffer.push("a");
        clock.advance(365L * 24 * 3600 * 1000);

        assertEquals(0, buffer.prune());
        assertEquals(1, buffer.validSize());
    }

    @Test
    @DisplayName("A cursor with a matching sequence but different timestamp is rejected")
    void testForeignCursorRejected() {
        RingBuffer<String> buffer = buffer(10, 0);
        buffer.push("a");

        assertFalse(buffer.isValidCursor(CursorCodec.create(0, 42)));
    }

    @Test
    @DisplayName("Clear drops entries but keeps the sequence counter")
    void testClearKeepsSequence() {
        RingBuffer<String> buffer = buffer(10, 0);
        buffer.push("a");
        buffer.push("b");
        buffer.clear();

        assertEquals(0, buffer.size());
        String next = buffer.push("c");
        assertEquals(2, CursorCodec.decode(next).orElseThrow().getSequence());
    }

    @Test
    @DisplayName("Utilization is the fill percentage")
    void testUtilization() {
        RingBuffer<String> buffer = buffer(4, 0);
        buffer.push("a");

        assertEquals(25.0, buffer.utilization(), 0.0001);
        assertEquals(4, buffer.getCapacity());
    }
}
