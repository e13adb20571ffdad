package com.sandy.aiot.edge.runtime.service;

import com.sandy.aiot.edge.runtime.entity.TelemetrySnapshot;
import com.sandy.aiot.edge.runtime.tools.MetricMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Random;

/**
 * Bounded random walk standing in for a plant edge node. Each call advances the walk one step.
 */
@Component
@Slf4j
public class DigitalTwinSimulator {

    public static final String TWIN_HOSTNAME = "digital-twin-edge";
    public static final String TWIN_PLATFORM = "Industrial Digital Twin";

    private final Random random;
    private final Clock clock;

    private double cpuPercent = 38.0;
    private double memoryPercent = 52.0;
    private double diskPercent = 48.0;
    private double batteryPercent = 78.0;
    private boolean powerPlugged = false;
    private int processCount = 190;

    public DigitalTwinSimulator(Random simulationRandom, Clock clock) {
        this.random = simulationRandom;
        this.clock = clock;
    }

    public synchronized TelemetrySnapshot next() {
        cpuPercent = step(cpuPercent, 7.0, 8.0, 96.0);
        memoryPercent = step(memoryPercent, 4.0, 20.0, 96.0);
        diskPercent = step(diskPercent, 1.2, 20.0, 98.0);
        processCount = Math.max(40, Math.min(600, processCount + randomInt(-8, 12)));

        if (powerPlugged) {
            batteryPercent = Math.min(100.0, batteryPercent + uniform(0.1, 0.7));
            if (batteryPercent >= 96 && random.nextDouble() < 0.2) powerPlugged = false;
        } else {
            batteryPercent = Math.max(8.0, batteryPercent - uniform(0.2, 0.9));
            if (batteryPercent <= 18 && random.nextDouble() < 0.35) powerPlugged = true;
        }
        batteryPercent = MetricMath.round2(batteryPercent);

        return TelemetrySnapshot.builder()
                .timestamp(clock.instant())
                .hostname(TWIN_HOSTNAME)
                .platform(TWIN_PLATFORM)
                .cpuPercent(MetricMath.round2(cpuPercent))
                .memoryPercent(MetricMath.round2(memoryPercent))
                .diskPercent(MetricMath.round2(diskPercent))
                .batteryPercent(batteryPercent)
                .powerPlugged(powerPlugged)
                .processCount(processCount)
                .faultFlag(false)
                .gridStatus(TelemetrySnapshot.GRID_HEALTHY)
                .build();
    }

    private double step(double value, double delta, double low, double high) {
        return MetricMath.clamp(value + uniform(-delta, delta), low, high);
    }

    private double uniform(double low, double high) {
        return low + (high - low) * random.nextDouble();
    }

    private int randomInt(int low, int highInclusive) {
        return low + random.nextInt(highInclusive - low + 1);
    }
}
