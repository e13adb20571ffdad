package com.sandy.aiot.edge.runtime.entity;

import lombok.Value;

/**
 * Active scenario and the number of cycles it still overrides.
 * Immutable; every transition yields a new state.
 */
@Value
public class ScenarioState {
    public static final int MAX_CYCLES = 240;
    public static final ScenarioState NORMAL = new ScenarioState(Scenario.NORMAL, 0);

    Scenario scenario;
    int cyclesLeft;

    /**
     * Clamps cycles to 0..240; a non-normal scenario always gets at least one cycle.
     */
    public static ScenarioState of(Scenario scenario, int cycles) {
        if (scenario == Scenario.NORMAL) return NORMAL;
        int clamped = Math.max(0, Math.min(cycles, MAX_CYCLES));
        return new ScenarioState(scenario, Math.max(1, clamped));
    }

    public boolean isNormal() {
        return scenario == Scenario.NORMAL;
    }

    /** State after one overridden cycle; reverts to normal when the counter runs out. */
    public ScenarioState advance() {
        if (isNormal()) return this;
        int left = Math.max(0, cyclesLeft - 1);
        return left == 0 ? NORMAL : new ScenarioState(scenario, left);
    }
}
