package com.sandy.aiot.edge.runtime.entity;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class HistoryRecord {
    Instant timestamp;
    String time;
    double optimization;
    /** Coarse energy sample, the cycle's cpu percentage. */
    double energy;
}
