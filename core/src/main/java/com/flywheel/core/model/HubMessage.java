package com.flywheel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Wire message delivered to subscribers and returned by replay.
 * <p>
 * <b>Ordering guarantee:</b> messages of one channel carry strictly increasing
 * sequences inside their cursors. No ordering is implied across channels.
 * </p>
 * <p>
 * <b>Idempotency:</b> replay pages may overlap live delivery around a reconnect;
 * clients deduplicate on {@code id}.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HubMessage {
    /**
     * Unique message ID (UUID).
     */
    String id;

    /**
     * Replay cursor; assigned when the message enters its channel buffer.
     */
    String cursor;

    /**
     * Creation time, ISO-8601.
     */
    String timestamp;

    String channel;

    /**
     * Message type (e.g. "agent.output", "agent.state").
     */
    String type;

    JsonNode payload;

    /**
     * Tracing metadata; null when no field is set.
     */
    EventMetadata metadata;
}
