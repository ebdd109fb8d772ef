package com.flywheel.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * A reconnecting client's request to catch up on one channel.
 */
@Value
@Builder(toBuilder = true)
public class ReplayRequest {
    String connectionId;
    String channel;
    String userId;

    /**
     * Last cursor the client saw (exclusive start); null replays from the earliest retained event.
     */
    String fromCursor;

    String correlationId;
}
