package com.pivotbot.backend.model;

/**
 * Advisor verdict, ordered from most bullish to most bearish.
 */
public enum AdvisorAction {
    STRONG_BUY,
    BUY,
    HOLD,
    SELL,
    STRONG_SELL;

    public boolean isBuy() {
        return this == STRONG_BUY || this == BUY;
    }

    public boolean isSell() {
        return this == STRONG_SELL || this == SELL;
    }

    /**
     * Maps a signed indicator score onto an action; anything beyond +/-2 saturates.
     */
    public static AdvisorAction fromScore(int score) {
        if (score >= 2) {
            return STRONG_BUY;
        }
        if (score == 1) {
            return BUY;
        }
        if (score == 0) {
            return HOLD;
        }
        if (score == -1) {
            return SELL;
        }
        return STRONG_SELL;
    }
}
