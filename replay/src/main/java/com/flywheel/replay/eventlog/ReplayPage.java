package com.flywheel.replay.eventlog;

import com.flywheel.core.model.PersistedEvent;

import java.util.List;

/**
 * Rows of one replay query plus whether more rows follow.
 */
public record ReplayPage(List<PersistedEvent> rows, boolean hasMore) {

    public static ReplayPage empty() {
        return new ReplayPage(List.of(), false);
    }

    /**
     * Row count to fetch for a page of {@code limit}: one extra, saturating at {@link Integer#MAX_VALUE}.
     */
    public static int lookahead(int limit) {
        return (int) Math.min((long) limit + 1, Integer.MAX_VALUE);
    }

    /**
     * Builds a page from a query that fetched up to {@code limit + 1} rows.
     */
    public static ReplayPage fromLookahead(List<PersistedEvent> fetched, int limit) {
        boolean hasMore = fetched.size() > limit;
        return new ReplayPage(hasMore ? List.copyOf(fetched.subList(0, limit)) : List.copyOf(fetched), hasMore);
    }
}
