package com.pivotbot.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Append-only history entry written for every fill.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TradeRecord {
    private final Instant timestamp;
    private final String symbol;
    private final OrderSide side;
    private final BigDecimal price;
    private final BigDecimal quantity;
    private final BigDecimal realizedPnl;
    private final String orderId;
    private final DecisionReason reason;

    @JsonCreator
    public TradeRecord(@JsonProperty("timestamp") Instant timestamp,
                       @JsonProperty("symbol") String symbol,
                       @JsonProperty("side") OrderSide side,
                       @JsonProperty("price") BigDecimal price,
                       @JsonProperty("quantity") BigDecimal quantity,
                       @JsonProperty("realizedPnl") BigDecimal realizedPnl,
                       @JsonProperty("orderId") String orderId,
                       @JsonProperty("reason") DecisionReason reason) {
        this.timestamp = Objects.requireNonNull(timestamp);
        this.symbol = Objects.requireNonNull(symbol);
        this.side = Objects.requireNonNull(side);
        this.price = Objects.requireNonNull(price);
        this.quantity = Objects.requireNonNull(quantity);
        this.realizedPnl = realizedPnl != null ? realizedPnl : BigDecimal.ZERO;
        this.orderId = orderId;
        this.reason = reason;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getSymbol() {
        return symbol;
    }

    public OrderSide getSide() {
        return side;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    public BigDecimal getRealizedPnl() {
        return realizedPnl;
    }

    public String getOrderId() {
        return orderId;
    }

    public DecisionReason getReason() {
        return reason;
    }

    /** Closing fills are the only ones that realize P&L. */
    public boolean isClosing() {
        return side == OrderSide.SELL;
    }

    @Override
    public String toString() {
        return "TradeRecord{" + timestamp + ' ' + side + ' ' + quantity + ' ' + symbol + " @" + price
                + ", pnl=" + realizedPnl + ", reason=" + reason + '}';
    }
}
