package com.sandy.aiot.edge.runtime.service;

import com.sandy.aiot.edge.runtime.entity.TelemetrySnapshot;

/**
 * Reads the local host's resource state.
 */
public interface TelemetryCollector {

    /**
     * Best available live reading: host sensors, then an out-of-process query,
     * then a load-average estimate.
     *
     * @throws TelemetryCollectionException only when the out-of-process query fails
     */
    TelemetrySnapshot collectLive();

    /**
     * Minimal reading derived from the load average; memory, disk and battery unknown.
     */
    TelemetrySnapshot estimateMinimal();
}
