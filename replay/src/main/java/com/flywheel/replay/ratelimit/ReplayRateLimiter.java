package com.flywheel.replay.ratelimit;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-connection replay frequency guard using a fixed one-minute window.
 * <p>
 * The first request of a window opens it with {@code count = 1}; later requests in
 * the same window are allowed while {@code count} stays below the channel's cap. A
 * request arriving after the window has elapsed opens a fresh one.
 * </p>
 * <p>
 * Buckets are never evicted implicitly; the connection owner must call
 * {@link #clearConnection(String)} on disconnect.
 * </p>
 */
public class ReplayRateLimiter {

    public static final long WINDOW_MS = 60_000L;

    private final Clock clock;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    public ReplayRateLimiter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Counts a replay request against the connection's current window.
     *
     * @param connectionId       Connection identifier
     * @param maxRequestsPerMinute Cap of the channel being replayed
     * @return true if the request is allowed
     */
    public boolean tryAcquire(String connectionId, int maxRequestsPerMinute) {
        long now = clock.millis();
        boolean[] allowed = {false};

        buckets.compute(connectionId, (id, bucket) -> {
            if (bucket == null || now - bucket.windowStart() > WINDOW_MS) {
                allowed[0] = true;
                return new Bucket(1, now);
            }
            if (bucket.count() >= maxRequestsPerMinute) {
                return bucket;
            }
            allowed[0] = true;
            return new Bucket(bucket.count() + 1, bucket.windowStart());
        });

        return allowed[0];
    }

    /**
     * Drops the connection's bucket; its next request opens a fresh window.
     */
    public void clearConnection(String connectionId) {
        buckets.remove(connectionId);
    }

    public int trackedConnections() {
        return buckets.size();
    }

    private record Bucket(int count, long windowStart) {
    }
}
