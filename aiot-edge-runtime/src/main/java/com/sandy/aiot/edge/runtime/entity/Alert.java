package com.sandy.aiot.edge.runtime.entity;

import lombok.Builder;
import lombok.Value;

/**
 * Alert raised by a scan cycle.
 */
@Value
@Builder(toBuilder = true)
public class Alert {
    public static final String CPU_PRESSURE_CRITICAL = "CPU Pressure Critical";
    public static final String MEMORY_PRESSURE_HIGH = "Memory Pressure High";
    public static final String LOW_BATTERY = "Low Battery Detected";
    public static final String GRID_FAILURE = "Grid Failure Simulation Active";

    long id;
    AlertSeverity severity;
    String title;
    String message;
    String time;
}
