package com.pivotbot.backend.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Everything a single trading cycle observed and decided, as handed to the report renderer.
 */
@Value
@Builder
public class CycleReport {
    Instant timestamp;
    String symbol;
    BigDecimal currentPrice;
    CycleOutcome outcome;
    DecisionState stateBefore;
    DecisionState stateAfter;
    TradeDecision action;
    DecisionReason reason;
    IndicatorSet indicators;
    PivotLevels pivotLevels;
    AdvisorRecommendation recommendation;
    PortfolioSnapshot portfolio;
    LimiterStatus limiter;
    ReconciliationReport reconciliation;
    // newest first
    List<PriceAlert> alerts;
    String message;
}
