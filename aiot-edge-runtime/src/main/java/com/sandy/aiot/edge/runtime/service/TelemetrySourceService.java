package com.sandy.aiot.edge.runtime.service;

import com.sandy.aiot.edge.runtime.entity.IndustrialMetrics;
import com.sandy.aiot.edge.runtime.entity.TelemetrySnapshot;
import com.sandy.aiot.edge.runtime.tools.MetricMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Live, simulated and blended telemetry, plus the plant metrics derived from a snapshot.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TelemetrySourceService {

    static final double EDGE_WEIGHT = 0.65;

    private final TelemetryCollector telemetryCollector;
    private final DigitalTwinSimulator digitalTwinSimulator;
    private final Clock clock;

    public TelemetrySnapshot collectLive() {
        return telemetryCollector.collectLive();
    }

    public TelemetrySnapshot estimateMinimal() {
        return telemetryCollector.estimateMinimal();
    }

    public TelemetrySnapshot collectSimulated() {
        return digitalTwinSimulator.next();
    }

    /**
     * Numeric fields are weighted 0.65 edge / 0.35 simulation; optional fields prefer the edge
     * value, the fault flag is OR-ed and grid status prefers the edge side.
     */
    public TelemetrySnapshot blend(TelemetrySnapshot edge, TelemetrySnapshot simulated) {
        Double battery = edge.getBatteryPercent() != null ? edge.getBatteryPercent() : simulated.getBatteryPercent();
        Boolean plugged = edge.getPowerPlugged() != null ? edge.getPowerPlugged() : simulated.getPowerPlugged();
        String gridStatus = firstNonBlank(edge.getGridStatus(), simulated.getGridStatus(), TelemetrySnapshot.GRID_HEALTHY);
        String hostname = firstNonBlank(edge.getHostname(), simulated.getHostname(), "edge-hybrid");
        String edgePlatform = firstNonBlank(edge.getPlatform(), "edge", "edge");

        return TelemetrySnapshot.builder()
                .timestamp(clock.instant())
                .hostname(hostname)
                .platform("Hybrid (" + edgePlatform + " + simulation)")
                .cpuPercent(MetricMath.round2(blendNumber(edge.getCpuPercent(), simulated.getCpuPercent())))
                .memoryPercent(MetricMath.round2(blendNumber(edge.getMemoryPercent(), simulated.getMemoryPercent())))
                .diskPercent(MetricMath.round2(blendNumber(edge.getDiskPercent(), simulated.getDiskPercent())))
                .batteryPercent(battery)
                .powerPlugged(plugged)
                .processCount((int) Math.round(blendNumber((double) edge.getProcessCount(), (double) simulated.getProcessCount())))
                .faultFlag(edge.isFaultFlag() || simulated.isFaultFlag())
                .gridStatus(gridStatus)
                .build();
    }

    public IndustrialMetrics industrialMetrics(TelemetrySnapshot snapshot) {
        double cpu = snapshot.getCpuPercent();
        double memory = snapshot.getMemoryPercent();
        double disk = snapshot.getDiskPercent();
        boolean fault = snapshot.isFaultFlag();
        String hostname = snapshot.getHostname() == null ? "edge-node" : snapshot.getHostname();

        return IndustrialMetrics.builder()
                .siteId("plant-" + (Math.floorMod(hostname.hashCode(), 7) + 1))
                .energyUsageKwh(Math.max(5.0, MetricMath.round2(cpu * 0.85 + memory * 0.45 + disk * 0.25)))
                .thermalIndexC(MetricMath.round2(24.0 + cpu * 0.36 + (fault ? 9.0 : 0.0)))
                .gridLoad(MetricMath.round2(MetricMath.clamp((cpu * 0.75 + memory * 0.25) / 100.0, 0.05, 0.99)))
                .gridStatus(snapshot.getGridStatus() == null ? TelemetrySnapshot.GRID_HEALTHY : snapshot.getGridStatus())
                .faultFlag(fault)
                .build();
    }

    static double blendNumber(Double edgeValue, Double simValue) {
        double e = edgeValue != null ? edgeValue : simValue != null ? simValue : 0.0;
        double s = simValue != null ? simValue : edgeValue != null ? edgeValue : 0.0;
        return e * EDGE_WEIGHT + s * (1.0 - EDGE_WEIGHT);
    }

    private static String firstNonBlank(String a, String b, String fallback) {
        if (a != null && !a.isBlank()) return a;
        if (b != null && !b.isBlank()) return b;
        return fallback;
    }
}
