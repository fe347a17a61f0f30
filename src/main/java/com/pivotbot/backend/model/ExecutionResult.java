package com.pivotbot.backend.model;

import lombok.Builder;
import lombok.Value;

/**
 * What the decision engine did with one cycle's decision.
 */
@Value
@Builder
public class ExecutionResult {
    DecisionState stateBefore;
    DecisionState stateAfter;
    TradeDecision action;
    DecisionReason reason;
    CycleOutcome outcome;
    Order order;
    Fill fill;
    TradeRecord tradeRecord;
    String message;

    public boolean isExecuted() {
        return outcome == CycleOutcome.EXECUTED;
    }
}
