package com.flywheel.replay.hub;

import com.flywheel.core.model.HubMessage;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One page of hot-tier catch-up served from a channel's ring buffer.
 */
@Value
@Builder(toBuilder = true)
public class HotReplay {
    List<HubMessage> messages;
    boolean hasMore;
    String lastCursor;

    /**
     * True when the client's cursor was no longer in the buffer and the page starts
     * at the oldest live entry instead.
     */
    boolean expired;

    public static HotReplay empty() {
        return HotReplay.builder().messages(List.of()).build();
    }
}
