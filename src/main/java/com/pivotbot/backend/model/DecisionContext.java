package com.pivotbot.backend.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Inputs of one state-machine evaluation.
 */
public final class DecisionContext {
    private final BigDecimal currentPrice;
    private final IndicatorSet indicators;
    private final AdvisorRecommendation recommendation;
    private final Position position;
    private final boolean tradingAllowed;

    public DecisionContext(BigDecimal currentPrice, IndicatorSet indicators, AdvisorRecommendation recommendation,
                           Position position, boolean tradingAllowed) {
        this.currentPrice = Objects.requireNonNull(currentPrice, "currentPrice");
        this.indicators = Objects.requireNonNull(indicators, "indicators");
        this.recommendation = Objects.requireNonNull(recommendation, "recommendation");
        this.position = position;
        this.tradingAllowed = tradingAllowed;
    }

    public BigDecimal getCurrentPrice() {
        return currentPrice;
    }

    public IndicatorSet getIndicators() {
        return indicators;
    }

    public AdvisorRecommendation getRecommendation() {
        return recommendation;
    }

    public Position getPosition() {
        return position;
    }

    public boolean isTradingAllowed() {
        return tradingAllowed;
    }
}
