package com.sandy.aiot.edge.runtime.service;

import com.sandy.aiot.edge.runtime.entity.OptimizationResult;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class OptimizationServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T10:15:30Z"), ZoneOffset.UTC);

    private final OptimizationService service = new OptimizationService(10, 100, 50, 0.12, 0.5, 0.3, CLOCK);

    @Test
    void overloadIsReducedToTheCeiling() {
        double required = service.requiredReduction(120);
        assertEquals(16.6667, required, 1e-3);
        double constrained = service.applyConstraints(120, required);
        assertEquals(100.0, 120 * (1 - constrained / 100), 1e-9);
        assertEquals(16.6667, constrained, 1e-3);
        assertEquals(0.85, service.stabilityScore(constrained));

        OptimizationResult result = service.optimizeLoad(120, 120.0);
        assertEquals(OptimizationResult.STATUS_OK, result.getStatus());
        assertEquals(16.6667, result.getRecommendedReduction(), 1e-3);
        assertEquals(0.85, result.getStabilityScore());
        assertEquals(120 * (result.getRecommendedReduction() / 100) * 0.12, result.getCostSavingEstimate(), 1e-9);
        assertEquals(CLOCK.instant(), result.getOptimizationTimestamp());
    }

    @Test
    void smallOverloadUsesDefaultReduction() {
        assertEquals(10.0, service.requiredReduction(105), 1e-9);
    }

    @Test
    void loadUnderCeilingGetsTrimmedDefault() {
        assertEquals(3.0, service.requiredReduction(80), 1e-9);
        OptimizationResult result = service.optimizeLoad(80, 80.0);
        assertEquals(3.0, result.getRecommendedReduction(), 1e-9);
        assertEquals(0.95, result.getStabilityScore());
    }

    @Test
    void reductionNeverBreachesTheFloor() {
        assertEquals(16.6667, service.applyConstraints(60, 50), 1e-3);
        assertEquals(0.0, service.applyConstraints(40, 20), 1e-9);
    }

    @Test
    void reductionIsCappedAtFifty() {
        OptimizationService loose = new OptimizationService(10, 100, 0, 0.12, 0.5, 0.3, CLOCK);
        assertEquals(50.0, loose.applyConstraints(1000, 90), 1e-9);
    }

    @Test
    void zeroLoadNeedsNoReduction() {
        assertEquals(0.0, service.applyConstraints(0, 30));
        OptimizationResult result = service.optimizeLoad(0, null);
        assertEquals(0.0, result.getRecommendedReduction());
        assertEquals(0.0, result.getPredictedLoad());
    }

    @Test
    void stabilityBands() {
        assertEquals(0.95, service.stabilityScore(9.99));
        assertEquals(0.85, service.stabilityScore(10));
        assertEquals(0.85, service.stabilityScore(24.9));
        assertEquals(0.70, service.stabilityScore(25));
    }

    @Test
    void multiObjectiveScoreIsLinear() {
        assertEquals(2.0 * 0.5 + 0.85 * 0.3, service.multiObjectiveScore(2.0, 0.85), 1e-9);
    }

    @Test
    void invalidLoadDegradesToFailedResult() {
        OptimizationResult result = service.optimizeLoad(Double.NaN, 10.0);
        assertTrue(result.isFailed());
        assertEquals(0.0, result.getRecommendedReduction());
        assertNull(result.getStabilityScore());
    }

    @Test
    void healthReflectsLastOptimization() {
        assertNull(service.getLastOptimizationTime());
        service.optimizeLoad(70, 70.0);
        assertEquals(CLOCK.instant(), service.getLastOptimizationTime());
        assertEquals("OK", service.healthStatus().get("status"));
        assertNotNull(service.getLastResult());
    }
}
