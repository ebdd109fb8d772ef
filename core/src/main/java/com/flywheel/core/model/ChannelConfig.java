package com.flywheel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Effective retention and replay policy for a channel.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChannelConfig {

    public static final ChannelConfig GLOBAL_DEFAULT = ChannelConfig.builder()
        .persistEvents(true)
        .retentionMs(300_000L)
        .maxEvents(10_000)
        .snapshotEnabled(false)
        .maxReplayRequestsPerMinute(10)
        .build();

    /**
     * Whether events on the channel are written to the durable log.
     */
    boolean persistEvents;

    /**
     * Cold-tier retention in milliseconds; 0 keeps rows until trimmed by {@link #maxEvents}.
     */
    long retentionMs;

    /**
     * Upper bound on durable rows per channel, enforced by the retention janitor.
     */
    int maxEvents;

    /**
     * Reserved for snapshot-based catch-up; replay currently ignores it.
     */
    boolean snapshotEnabled;

    /**
     * Reserved, see {@link #snapshotEnabled}.
     */
    Long snapshotIntervalMs;

    /**
     * Replay calls allowed per connection per one-minute window.
     */
    int maxReplayRequestsPerMinute;
}
