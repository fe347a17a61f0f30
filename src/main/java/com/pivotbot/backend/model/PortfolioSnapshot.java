package com.pivotbot.backend.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable copy of the ledger handed to reporting and to the advisor prompt.
 */
@Value
@Builder
public class PortfolioSnapshot {
    Map<String, BigDecimal> balances;
    Position position;
    BigDecimal realizedPnl;
    BigDecimal unrealizedPnl;
    BigDecimal markPrice;
    BigDecimal portfolioValue;
    List<TradeRecord> trades;
    int totalTrades;
    int winningTrades;
    int losingTrades;
    BigDecimal winRate;
    BigDecimal largestWin;
    BigDecimal largestLoss;
    Instant takenAt;

    public boolean hasPosition() {
        return position != null;
    }

    public BigDecimal balanceOf(String asset) {
        BigDecimal amount = balances != null ? balances.get(asset) : null;
        return amount != null ? amount : BigDecimal.ZERO;
    }
}
