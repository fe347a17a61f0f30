package com.pivotbot.backend.model;

import java.util.Objects;

/**
 * Output of one evaluation of the trading state machine.
 */
public final class Decision {
    private final TradeDecision action;
    private final DecisionReason reason;
    private final DecisionState nextStateOnFill;

    private Decision(TradeDecision action, DecisionReason reason, DecisionState nextStateOnFill) {
        this.action = Objects.requireNonNull(action);
        this.reason = Objects.requireNonNull(reason);
        this.nextStateOnFill = Objects.requireNonNull(nextStateOnFill);
    }

    public static Decision buy(DecisionReason reason) {
        return new Decision(TradeDecision.BUY, reason, DecisionState.POSITION_OPEN);
    }

    public static Decision sell(DecisionReason reason) {
        return new Decision(TradeDecision.SELL, reason, DecisionState.IDLE);
    }

    public static Decision hold(DecisionReason reason, DecisionState current) {
        return new Decision(TradeDecision.HOLD, reason, current);
    }

    public TradeDecision getAction() {
        return action;
    }

    public DecisionReason getReason() {
        return reason;
    }

    /** State the engine moves to once the order is confirmed; for HOLD this is the current state. */
    public DecisionState getNextStateOnFill() {
        return nextStateOnFill;
    }

    public boolean isOrder() {
        return action != TradeDecision.HOLD;
    }

    @Override
    public String toString() {
        return action + "(" + reason + ")";
    }
}
