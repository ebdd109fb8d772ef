package com.flywheel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Optional tracing metadata attached to a published event.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EventMetadata {
    String correlationId;
    String agentId;
    String userId;
    String workspaceId;

    @JsonIgnore
    public boolean isEmpty() {
        return correlationId == null && agentId == null && userId == null && workspaceId == null;
    }
}
