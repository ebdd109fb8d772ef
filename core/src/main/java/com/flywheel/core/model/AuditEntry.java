package com.flywheel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Immutable record of a served replay call.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuditEntry {
    String id;
    String connectionId;
    String userId;
    String channel;
    String fromCursor;
    String toCursor;
    int messagesReplayed;
    boolean cursorExpired;
    boolean usedSnapshot;

    /**
     * Epoch millis the request arrived.
     */
    long requestedAt;

    long durationMs;
    String correlationId;
}
