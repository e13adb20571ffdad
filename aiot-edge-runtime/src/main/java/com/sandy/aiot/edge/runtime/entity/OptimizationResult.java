package com.sandy.aiot.edge.runtime.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Bounded load reduction recommendation. A failed optimization carries only
 * a zero reduction and status "failed".
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OptimizationResult {
    public static final String STATUS_OK = "ok";
    public static final String STATUS_FAILED = "failed";

    double recommendedReduction;
    Double predictedLoad;
    Double costSavingEstimate;
    Double stabilityScore;
    Instant optimizationTimestamp;
    String status;

    public static OptimizationResult failed() {
        return OptimizationResult.builder().recommendedReduction(0).status(STATUS_FAILED).build();
    }

    @JsonIgnore
    public boolean isFailed() {
        return STATUS_FAILED.equals(status);
    }
}
