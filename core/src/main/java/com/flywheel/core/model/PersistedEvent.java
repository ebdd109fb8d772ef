package com.flywheel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Cold-tier row of the durable event log.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PersistedEvent {
    String id;
    String channel;
    String cursor;
    long sequence;
    String messageType;

    /**
     * JSON text of the payload.
     */
    String payload;

    String correlationId;
    String agentId;
    String workspaceId;

    /**
     * Insert time (epoch millis).
     */
    long createdAt;

    /**
     * Expiry time (epoch millis); null keeps the row until per-channel trimming.
     */
    Long expiresAt;

    @JsonIgnore
    public boolean isExpiredAt(long nowMs) {
        return expiresAt != null && expiresAt <= nowMs;
    }
}
