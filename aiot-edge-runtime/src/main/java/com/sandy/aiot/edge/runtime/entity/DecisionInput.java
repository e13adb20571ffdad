package com.sandy.aiot.edge.runtime.entity;

import lombok.Builder;
import lombok.Value;

/**
 * Snapshot projected onto the schema the decision function was trained on.
 */
@Value
@Builder
public class DecisionInput {
    public static final String STATE_NORMAL = "normal";
    public static final String STATE_HIGH_LOAD = "high_load";
    public static final String STATE_GRID_FAILURE = "grid_failure";

    int buildingId;
    double temperature;
    double humidity;
    /** Always at least 1. */
    int occupancy;
    /** Monday = 0. */
    int dayOfWeek;
    int hour;
    double currentLoad;
    double energyUsageKwh;
    String state;
    String location;
    boolean faultFlag;
    String gridStatus;
}
