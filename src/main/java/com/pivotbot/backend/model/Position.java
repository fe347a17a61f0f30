package com.pivotbot.backend.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.Objects;

/**
 * The single open position. Stop-loss and take-profit are fixed when the position opens.
 */
public final class Position {
    private final String symbol;
    private final OrderSide side;
    private final BigDecimal entryPrice;
    private final BigDecimal quantity;
    private final BigDecimal stopLoss;
    private final BigDecimal takeProfit;
    private final Instant openedAt;

    public Position(String symbol, OrderSide side, BigDecimal entryPrice, BigDecimal quantity,
                    BigDecimal stopLoss, BigDecimal takeProfit, Instant openedAt) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.side = Objects.requireNonNull(side, "side");
        this.entryPrice = Objects.requireNonNull(entryPrice, "entryPrice");
        this.quantity = Objects.requireNonNull(quantity, "quantity");
        this.stopLoss = Objects.requireNonNull(stopLoss, "stopLoss");
        this.takeProfit = Objects.requireNonNull(takeProfit, "takeProfit");
        this.openedAt = Objects.requireNonNull(openedAt, "openedAt");
    }

    public String getSymbol() {
        return symbol;
    }

    public OrderSide getSide() {
        return side;
    }

    public BigDecimal getEntryPrice() {
        return entryPrice;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    public BigDecimal getStopLoss() {
        return stopLoss;
    }

    public BigDecimal getTakeProfit() {
        return takeProfit;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }

    public int sign() {
        return side == OrderSide.BUY ? 1 : -1;
    }

    public BigDecimal unrealizedPnl(BigDecimal markPrice) {
        return markPrice.subtract(entryPrice)
                .multiply(quantity, MathContext.DECIMAL64)
                .multiply(BigDecimal.valueOf(sign()));
    }

    @Override
    public String toString() {
        return "Position{" + side + ' ' + quantity + ' ' + symbol + " @" + entryPrice
                + ", sl=" + stopLoss + ", tp=" + takeProfit + ", opened=" + openedAt + '}';
    }
}
