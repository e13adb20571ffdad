package com.sandy.aiot.edge.runtime.entity;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One cycle's consolidated telemetry reading. Percentages are within 0..100.
 * Battery level and plug state are null when the host has no battery sensor.
 */
@Value
@Builder(toBuilder = true)
public class TelemetrySnapshot {
    public static final String GRID_HEALTHY = "healthy";

    Instant timestamp;
    String hostname;
    String platform;
    double cpuPercent;
    double memoryPercent;
    double diskPercent;
    Double batteryPercent;
    Boolean powerPlugged;
    int processCount;
    boolean faultFlag;
    String gridStatus;

    /** Populated by the orchestrator once the source and scenario are settled. */
    RuntimeMode scanMode;
    Scenario scenario;
    IndustrialMetrics industrialMetrics;

    public boolean hasBattery() {
        return batteryPercent != null;
    }

    public double gridLoadOrCpu() {
        if (industrialMetrics != null) return industrialMetrics.getGridLoad();
        return Math.min(1.0, Math.max(0.0, cpuPercent / 100.0));
    }

    public boolean industrialFault() {
        return industrialMetrics != null && industrialMetrics.isFaultFlag();
    }
}
