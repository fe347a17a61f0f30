package com.pivotbot.backend.model;

public enum CycleOutcome {
    /** An order was filled and recorded. */
    EXECUTED,
    HOLD,
    /** Not enough data or market data unavailable. */
    SKIPPED,
    /** Deadline expired before any state was mutated. */
    ABANDONED,
    /** The order could not be executed (rejection or persistence failure). */
    NOT_EXECUTED
}
