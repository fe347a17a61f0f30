package com.pivotbot.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradingStatusResponse {
    private String symbol;
    private DecisionState state;
    private boolean cycleRunning;
    private Instant lastCycleAt;
    private CycleReport lastCycle;
    private LimiterStatus limiter;
    private BigDecimal realizedPnl;
    private BigDecimal unrealizedPnl;
    private BigDecimal portfolioValue;
}
