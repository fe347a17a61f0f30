package com.pivotbot.backend.model;

/**
 * Why a cycle produced the decision it did.
 */
public enum DecisionReason {
    ADVISOR_BUY,
    RSI_OVERSOLD,
    SMA_CROSS_UP,
    STOP_LOSS,
    TAKE_PROFIT,
    ADVISOR_SELL,
    DAILY_LIMIT,
    NO_SIGNAL,
    ADVISOR_VETO,
    BELOW_MIN_NOTIONAL,
    PERSISTENCE_FAILURE,
    EXCHANGE_REJECTED
}
