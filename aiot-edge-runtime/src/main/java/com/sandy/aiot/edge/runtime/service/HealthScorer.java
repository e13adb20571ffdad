package com.sandy.aiot.edge.runtime.service;

import com.sandy.aiot.edge.runtime.entity.RuntimeHealthMetric;
import com.sandy.aiot.edge.runtime.entity.TelemetrySnapshot;
import com.sandy.aiot.edge.runtime.tools.MetricMath;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class HealthScorer {

    public static final String CPU_HEADROOM = "CPU Headroom";
    public static final String MEMORY_HEADROOM = "Memory Headroom";
    public static final String GRID_RESILIENCE = "Grid Resilience";
    public static final String POWER_HEALTH = "Power Health";
    public static final String DECISION_STABILITY = "Decision Stability";

    static final double FAULT_PENALTY = 25.0;
    static final double FAULT_RESILIENCE_LOSS = 35.0;

    /**
     * Single 5..100 score; higher means more headroom left on the node.
     */
    public double optimizationScore(TelemetrySnapshot snapshot) {
        double batteryPenalty = snapshot.hasBattery() ? Math.max(0.0, 100.0 - snapshot.getBatteryPercent()) : 0.0;
        double faultPenalty = snapshot.industrialFault() ? FAULT_PENALTY : 0.0;
        double score = 100.0 - (snapshot.getCpuPercent() * 0.3
                + snapshot.getMemoryPercent() * 0.25
                + snapshot.getDiskPercent() * 0.1
                + snapshot.gridLoadOrCpu() * 100.0 * 0.25
                + batteryPenalty * 0.1
                + faultPenalty);
        return MetricMath.round2(MetricMath.clamp(score, 5.0, 100.0));
    }

    /**
     * @param stability embedded decision stability in 0..1
     */
    public List<RuntimeHealthMetric> runtimeHealth(TelemetrySnapshot snapshot, double stability) {
        double gridResilience = MetricMath.clampPercent(100.0 - snapshot.gridLoadOrCpu() * 100.0);
        if (snapshot.industrialFault()) {
            gridResilience = Math.max(0.0, gridResilience - FAULT_RESILIENCE_LOSS);
        }
        double powerHealth = snapshot.hasBattery() ? snapshot.getBatteryPercent() : 100.0;
        return List.of(
                metric(CPU_HEADROOM, 100.0 - snapshot.getCpuPercent()),
                metric(MEMORY_HEADROOM, 100.0 - snapshot.getMemoryPercent()),
                metric(GRID_RESILIENCE, gridResilience),
                metric(POWER_HEALTH, powerHealth),
                metric(DECISION_STABILITY, stability * 100.0));
    }

    private static RuntimeHealthMetric metric(String name, double value) {
        return new RuntimeHealthMetric(name, MetricMath.round2(MetricMath.clampPercent(value)));
    }
}
