package com.flywheel.core.channel;

/**
 * Helpers for colon-delimited channel names ({@code <scope>:<kind>[:<id>...]}).
 */
public final class ChannelNames {
    private ChannelNames() {
    }

    public static final String WILDCARD = "*";

    /**
     * Extracts the channel type, e.g. {@code agent:output} from {@code agent:output:run42}.
     * <p>
     * Names with fewer than two non-empty leading segments are their own type.
     * </p>
     */
    public static String typePrefix(String channel) {
        String[] parts = channel.split(":", 3);
        if (parts.length >= 2 && !parts[0].isEmpty() && !parts[1].isEmpty()) {
            return parts[0] + ":" + parts[1];
        }
        return channel;
    }

    public static boolean isWildcard(String pattern) {
        return pattern.endsWith(WILDCARD);
    }

    /**
     * @return Literal prefix of a wildcard pattern ({@code agent:output:*} gives {@code agent:output:})
     */
    public static String wildcardPrefix(String pattern) {
        return pattern.substring(0, pattern.length() - WILDCARD.length());
    }
}
