package com.sandy.aiot.edge.runtime.service;

import com.sandy.aiot.edge.runtime.entity.Decision;
import com.sandy.aiot.edge.runtime.entity.DecisionInput;

/**
 * Decision function consulted once per scan cycle. Implementations may be backed by trained
 * models; the runtime never fits models itself.
 */
public interface DecisionEngine {

    Decision generateDecision(DecisionInput input);
}
