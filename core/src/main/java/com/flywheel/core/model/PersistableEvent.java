package com.flywheel.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Event handed to the durable log by the publish path.
 * <p>
 * Cursor and sequence are assigned by the channel's hot-tier buffer before the
 * log sees the event; the log only stores that ordering.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class PersistableEvent {
    String id;
    String channel;
    String cursor;
    long sequence;
    String messageType;

    /**
     * Application payload; serialized to JSON when stored.
     */
    Object payload;

    EventMetadata metadata;
}
