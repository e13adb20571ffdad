package com.sandy.aiot.edge.runtime.service.impl;

import com.sandy.aiot.edge.runtime.entity.Decision;
import com.sandy.aiot.edge.runtime.entity.DecisionInput;
import com.sandy.aiot.edge.runtime.entity.OptimizationResult;
import com.sandy.aiot.edge.runtime.service.DecisionEngine;
import com.sandy.aiot.edge.runtime.service.LoadForecastService;
import com.sandy.aiot.edge.runtime.service.OptimizationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Default decision function: forecast the next load, optimize the reduction and name an action.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OptimizationDecisionEngine implements DecisionEngine {

    public static final String ACTION_FAILOVER = "failover";
    public static final String ACTION_SHED_LOAD = "shed_load";
    public static final String ACTION_MAINTAIN = "maintain";

    private final LoadForecastService loadForecastService;
    private final OptimizationService optimizationService;
    private final Clock clock;

    @Override
    public Decision generateDecision(DecisionInput input) {
        double currentLoad = input.getCurrentLoad();
        double predictedLoad = loadForecastService.predictNext(currentLoad);
        OptimizationResult result = optimizationService.optimizeLoad(currentLoad, predictedLoad);
        String action = chooseAction(input, result);
        log.debug("Decision state={} load={} predicted={} reduction={} action={}",
                input.getState(), currentLoad, predictedLoad, result.getRecommendedReduction(), action);
        return Decision.builder()
                .timestamp(clock.instant())
                .rlAction(action)
                .optimizedDecision(result)
                .build();
    }

    private String chooseAction(DecisionInput input, OptimizationResult result) {
        if (DecisionInput.STATE_GRID_FAILURE.equals(input.getState())) return ACTION_FAILOVER;
        if (!result.isFailed() && result.getRecommendedReduction() >= 10) return ACTION_SHED_LOAD;
        return ACTION_MAINTAIN;
    }
}
