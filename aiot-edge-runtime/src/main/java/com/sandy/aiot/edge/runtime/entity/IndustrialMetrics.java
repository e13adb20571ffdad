package com.sandy.aiot.edge.runtime.entity;

import lombok.Builder;
import lombok.Value;

/**
 * Plant-level view derived from a host snapshot.
 */
@Value
@Builder
public class IndustrialMetrics {
    String siteId;
    double energyUsageKwh;
    double thermalIndexC;
    /** Fraction of grid capacity in use, 0.05..0.99. */
    double gridLoad;
    String gridStatus;
    boolean faultFlag;
}
