package com.sandy.aiot.edge.runtime.service;

import com.sandy.aiot.edge.runtime.entity.OptimizationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Constrained load reduction: turns a predicted load into a bounded reduction recommendation
 * with a cost saving estimate and a coarse stability score.
 */
@Service
@Slf4j
public class OptimizationService {

    static final double MAX_REDUCTION_PERCENT = 50.0;

    private final double defaultReduction;
    private final double maxLoad;
    private final double minLoad;
    private final double costPerUnit;
    private final double costWeight;
    private final double stabilityWeight;
    private final Clock clock;

    private volatile OptimizationResult lastResult;
    private volatile Instant lastOptimizationTime;

    public OptimizationService(@Value("${optimization.default-reduction-percent:10}") double defaultReduction,
                               @Value("${optimization.max-allowed-load:100}") double maxLoad,
                               @Value("${optimization.min-allowed-load:50}") double minLoad,
                               @Value("${optimization.energy-cost-per-unit:0.12}") double costPerUnit,
                               @Value("${optimization.cost-weight:0.5}") double costWeight,
                               @Value("${optimization.stability-weight:0.3}") double stabilityWeight,
                               Clock clock) {
        this.defaultReduction = defaultReduction;
        this.maxLoad = maxLoad;
        this.minLoad = minLoad;
        this.costPerUnit = costPerUnit;
        this.costWeight = costWeight;
        this.stabilityWeight = stabilityWeight;
        this.clock = clock;
        log.info("Optimization service initialized: defaultReduction={} maxLoad={} minLoad={} costPerUnit={}",
                defaultReduction, maxLoad, minLoad, costPerUnit);
    }

    /**
     * Main entry point. Never throws: any failure yields {@link OptimizationResult#failed()}.
     *
     * @param predictedLoad forecast load; the current load is used when null
     */
    public OptimizationResult optimizeLoad(double currentLoad, Double predictedLoad) {
        try {
            double predicted = predictedLoad != null ? predictedLoad : currentLoad;
            if (!Double.isFinite(currentLoad) || !Double.isFinite(predicted)) {
                throw new IllegalArgumentException("non-finite load current=" + currentLoad + " predicted=" + predicted);
            }
            double required = requiredReduction(predicted);
            double constrained = applyConstraints(currentLoad, required);
            double cost = costSaving(constrained, currentLoad);
            double stability = stabilityScore(constrained);

            Instant now = clock.instant();
            OptimizationResult result = OptimizationResult.builder()
                    .recommendedReduction(constrained)
                    .predictedLoad(predicted)
                    .costSavingEstimate(cost)
                    .stabilityScore(stability)
                    .optimizationTimestamp(now)
                    .status(OptimizationResult.STATUS_OK)
                    .build();
            lastResult = result;
            lastOptimizationTime = now;
            return result;
        } catch (Exception e) {
            log.error("Optimization failed current={} predicted={}: {}", currentLoad, predictedLoad, e.getMessage(), e);
            return OptimizationResult.failed();
        }
    }

    public double requiredReduction(double predictedLoad) {
        if (predictedLoad > maxLoad) {
            double percent = (predictedLoad - maxLoad) / predictedLoad * 100.0;
            return Math.max(percent, defaultReduction);
        }
        return defaultReduction * 0.3;
    }

    /**
     * Caps the reduction at 50% and never lets the reduced load fall below the floor.
     */
    public double applyConstraints(double currentLoad, double reduction) {
        if (currentLoad == 0) return 0;
        double reducedLoad = currentLoad * (1 - reduction / 100.0);
        if (reducedLoad < minLoad) {
            double safeReduction = (currentLoad - minLoad) / currentLoad * 100.0;
            return Math.max(safeReduction, 0);
        }
        return Math.min(reduction, MAX_REDUCTION_PERCENT);
    }

    public double costSaving(double reduction, double currentLoad) {
        return currentLoad * (reduction / 100.0) * costPerUnit;
    }

    /** Three-tier banding: below 10% is low risk, below 25% moderate, otherwise high. */
    public double stabilityScore(double reduction) {
        if (reduction < 10) return 0.95;
        if (reduction < 25) return 0.85;
        return 0.70;
    }

    public double multiObjectiveScore(double costSaving, double stabilityScore) {
        return costSaving * costWeight + stabilityScore * stabilityWeight;
    }

    public OptimizationResult getLastResult() {
        return lastResult;
    }

    public Instant getLastOptimizationTime() {
        return lastOptimizationTime;
    }

    public Map<String, Object> healthStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("last_optimization_time", lastOptimizationTime);
        status.put("status", "OK");
        return status;
    }
}
