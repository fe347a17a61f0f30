package com.pivotbot.backend.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class LimiterStatus {
    LocalDate utcDate;
    int tradesExecuted;
    int tradesRemaining;
    int maxTradesPerDay;
    BigDecimal dailyRealizedPnl;
    Instant nextResetAt;
    boolean persistenceHealthy;
    List<TradeRecord> tradesToday;
}
