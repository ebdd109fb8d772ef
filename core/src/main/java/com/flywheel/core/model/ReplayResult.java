package com.flywheel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One page of replayed messages.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReplayResult {
    /**
     * Messages ascending by sequence.
     */
    List<HubMessage> messages;

    /**
     * Cursor of the last message; null on an empty page.
     */
    String lastCursor;

    boolean hasMore;

    /**
     * The supplied cursor was stale or malformed and the page starts at the earliest retained event.
     */
    boolean cursorExpired;

    boolean usedSnapshot;

    public static ReplayResult empty() {
        return ReplayResult.builder()
            .messages(List.of())
            .hasMore(false)
            .cursorExpired(false)
            .usedSnapshot(false)
            .build();
    }
}
