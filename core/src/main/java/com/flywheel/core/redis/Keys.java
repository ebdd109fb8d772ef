package com.flywheel.core.redis;

/**
 * Redis keyspace of the durable event log, channel config table and replay audit log.
 * <p>
 * <b>Key design principles:</b>
 * <ul>
 *   <li>Namespace prefixes avoid collisions (evt:, ws:, replay:)</li>
 *   <li>Per-channel keys so trimming one channel never scans another</li>
 *   <li>Sorted sets for ordered access, hashes for row bodies</li>
 * </ul>
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    /**
     * Sequence index of a channel: {@code evt:idx:{channel}}
     * <p>
     * <b>Type:</b> Sorted set, member = event id, score = sequence
     * <br>
     * <b>Usage:</b> replay range queries ({@code ZRANGEBYSCORE (seq +inf}) and oldest-first trimming
     * </p>
     */
    public static String eventIndex(String channel) {
        return "evt:idx:" + channel;
    }

    /**
     * Row bodies of a channel: {@code evt:row:{channel}}
     * <p>
     * <b>Type:</b> Hash, field = event id, value = JSON {@code PersistedEvent}
     * </p>
     */
    public static String eventRows(String channel) {
        return "evt:row:" + channel;
    }

    /**
     * Expiry index of a channel: {@code evt:exp:{channel}}
     * <p>
     * <b>Type:</b> Sorted set, member = event id, score = expiresAt (epoch millis)
     * <br>
     * Rows without an expiry are not indexed here.
     * </p>
     */
    public static String eventExpiry(String channel) {
        return "evt:exp:" + channel;
    }

    /**
     * Registry of channels that have (or had) durable rows: {@code evt:channels}
     * <p>
     * <b>Type:</b> Set of channel names
     * </p>
     */
    public static String eventChannels() {
        return "evt:channels";
    }

    /**
     * Channel policy overrides: {@code ws:channel-config}
     * <p>
     * <b>Type:</b> Hash, field = channel pattern (exact name or {@code prefix*}),
     * value = JSON {@code ChannelConfig}
     * </p>
     */
    public static String channelConfig() {
        return "ws:channel-config";
    }

    /**
     * Replay audit trail: {@code replay:audit}
     * <p>
     * <b>Type:</b> Sorted set, member = JSON {@code AuditEntry}, score = requestedAt
     * <br>
     * <b>Retention:</b> age-based, independent of channel retention
     * </p>
     */
    public static String replayAudit() {
        return "replay:audit";
    }
}
