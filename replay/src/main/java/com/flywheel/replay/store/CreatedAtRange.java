package com.flywheel.replay.store;

/**
 * Oldest and newest {@code createdAt} (epoch millis) among stored rows.
 */
public record CreatedAtRange(long oldest, long newest) {
}
