package com.sandy.aiot.edge.runtime.service;

import com.sandy.aiot.edge.runtime.entity.Decision;
import com.sandy.aiot.edge.runtime.entity.DecisionInput;
import com.sandy.aiot.edge.runtime.entity.IndustrialMetrics;
import com.sandy.aiot.edge.runtime.entity.OptimizationResult;
import com.sandy.aiot.edge.runtime.entity.TelemetrySnapshot;
import com.sandy.aiot.edge.runtime.tools.MetricMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Maps snapshots onto the decision function's input schema and shields the scan loop
 * from decision failures.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DecisionBridge {

    /** Stability assumed when a decision carries no usable score. */
    public static final double DEFAULT_STABILITY = 0.9;
    static final String ACTION_HOLD = "hold";

    private final DecisionEngine decisionEngine;
    private final Clock clock;

    public DecisionInput toDecisionInput(TelemetrySnapshot snapshot) {
        LocalDateTime now = LocalDateTime.now(clock);
        IndustrialMetrics industrial = snapshot.getIndustrialMetrics();
        double cpu = snapshot.getCpuPercent();
        double memory = snapshot.getMemoryPercent();

        double temperature = industrial != null
                ? industrial.getThermalIndexC()
                : MetricMath.clamp(30.0 + cpu * 0.45, 25.0, 85.0);
        double humidity = MetricMath.clamp(35.0 + memory * 0.35, 30.0, 85.0);
        double energy = industrial != null
                ? industrial.getEnergyUsageKwh()
                : Math.max(1.0, MetricMath.round2(cpu * 0.55 + memory * 0.25));
        boolean fault = snapshot.isFaultFlag();
        String gridStatus = snapshot.getGridStatus() == null ? TelemetrySnapshot.GRID_HEALTHY : snapshot.getGridStatus();

        String state = DecisionInput.STATE_NORMAL;
        if (fault || "down".equals(gridStatus)) {
            state = DecisionInput.STATE_GRID_FAILURE;
        } else if (cpu >= 85) {
            state = DecisionInput.STATE_HIGH_LOAD;
        }

        return DecisionInput.builder()
                .buildingId(1)
                .temperature(MetricMath.round2(temperature))
                .humidity(MetricMath.round2(humidity))
                .occupancy(Math.max(1, snapshot.getProcessCount()))
                .dayOfWeek(now.getDayOfWeek().getValue() - 1)
                .hour(now.getHour())
                .currentLoad(MetricMath.round2(snapshot.gridLoadOrCpu() * 100.0))
                .energyUsageKwh(energy)
                .state(state)
                .location(industrial != null ? industrial.getSiteId()
                        : snapshot.getHostname() != null ? snapshot.getHostname() : "local-machine")
                .faultFlag(fault)
                .gridStatus(gridStatus)
                .build();
    }

    /**
     * Consults the decision function. A failing or empty answer degrades to a hold decision
     * with a failed optimization rather than aborting the cycle.
     */
    public Decision requestDecision(DecisionInput input) {
        try {
            Decision decision = decisionEngine.generateDecision(input);
            if (decision != null) return decision;
            log.warn("Decision engine returned no decision for state={}", input.getState());
        } catch (Exception e) {
            log.error("Decision engine failed: {}", e.getMessage(), e);
        }
        return Decision.builder()
                .timestamp(clock.instant())
                .rlAction(ACTION_HOLD)
                .optimizedDecision(OptimizationResult.failed())
                .build();
    }

    public double stabilityOf(Decision decision) {
        if (decision == null) return DEFAULT_STABILITY;
        return decision.getEmbeddedStability().orElse(DEFAULT_STABILITY);
    }
}
