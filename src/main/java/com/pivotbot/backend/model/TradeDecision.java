package com.pivotbot.backend.model;

/**
 * Enum representing possible trade decisions
 */
public enum TradeDecision {
    BUY,
    SELL,
    HOLD
}
