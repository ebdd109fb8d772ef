package com.flywheel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Durable log occupancy snapshot.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EventLogStats {
    long totalEvents;
    Map<String, Long> eventsByChannel;

    /**
     * Millis since the oldest row was written; null when the log is empty.
     */
    Long oldestEventAge;

    /**
     * Millis since the newest row was written; null when the log is empty.
     */
    Long newestEventAge;

    public static EventLogStats empty() {
        return EventLogStats.builder().totalEvents(0).eventsByChannel(Map.of()).build();
    }
}
