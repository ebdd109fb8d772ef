package com.flywheel.replay.retention;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one janitor run. A failed phase contributes 0 to its count and its name
 * to {@link #failedPhases}.
 */
@Value
@Builder(toBuilder = true)
public class JanitorReport {
    long expiredDeleted;
    long trimmedDeleted;
    long auditDeleted;
    int hotPruned;
    @Singular
    List<String> failedPhases;

    public boolean isClean() {
        return failedPhases.isEmpty();
    }
}
