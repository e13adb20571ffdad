package com.sandy.aiot.edge.runtime.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.OptionalDouble;

/**
 * Output of the decision function for one cycle.
 */
@Value
@Builder
public class Decision {
    Instant timestamp;
    String rlAction;
    OptimizationResult optimizedDecision;

    /**
     * Stability score embedded in the optimized decision, empty when the decision
     * carries none or the value is outside 0..1.
     */
    @JsonIgnore
    public OptionalDouble getEmbeddedStability() {
        if (optimizedDecision == null || optimizedDecision.getStabilityScore() == null) {
            return OptionalDouble.empty();
        }
        double s = optimizedDecision.getStabilityScore();
        if (Double.isNaN(s) || s < 0 || s > 1) return OptionalDouble.empty();
        return OptionalDouble.of(s);
    }
}
