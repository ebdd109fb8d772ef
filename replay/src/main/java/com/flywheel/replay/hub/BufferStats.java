package com.flywheel.replay.hub;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BufferStats {
    int size;
    int validSize;
    int capacity;
    double utilization;
}
