package com.sandy.aiot.edge.runtime.service;

import com.sandy.aiot.edge.runtime.entity.Scenario;
import com.sandy.aiot.edge.runtime.entity.TelemetrySnapshot;
import org.springframework.stereotype.Component;

/**
 * Deterministic scenario overrides applied to a cycle's snapshot.
 */
@Component
public class ScenarioInjector {

    public static final String GRID_STRESSED = "stressed";
    public static final String GRID_RELAXED = "relaxed";
    public static final String GRID_DOWN = "down";

    public TelemetrySnapshot apply(TelemetrySnapshot snapshot, Scenario scenario) {
        TelemetrySnapshot.TelemetrySnapshotBuilder b = snapshot.toBuilder();
        switch (scenario) {
            case PEAK_LOAD -> b
                    .cpuPercent(Math.max(92.0, snapshot.getCpuPercent()))
                    .memoryPercent(Math.max(88.0, snapshot.getMemoryPercent()))
                    .diskPercent(Math.max(78.0, snapshot.getDiskPercent()))
                    .processCount(Math.max(450, snapshot.getProcessCount()))
                    .faultFlag(false)
                    .gridStatus(GRID_STRESSED);
            case LOW_LOAD -> b
                    .cpuPercent(Math.min(18.0, snapshot.getCpuPercent()))
                    .memoryPercent(Math.min(40.0, snapshot.getMemoryPercent()))
                    .processCount(Math.max(30, Math.min(120, snapshot.getProcessCount())))
                    .faultFlag(false)
                    .gridStatus(GRID_RELAXED);
            case GRID_FAILURE -> b
                    .cpuPercent(Math.max(72.0, snapshot.getCpuPercent()))
                    .memoryPercent(Math.max(70.0, snapshot.getMemoryPercent()))
                    .faultFlag(true)
                    .gridStatus(GRID_DOWN);
            // normal operation clears any edge-detected fault
            case NORMAL -> b
                    .faultFlag(false)
                    .gridStatus(TelemetrySnapshot.GRID_HEALTHY);
        }
        return b.build();
    }
}
