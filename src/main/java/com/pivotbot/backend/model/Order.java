package com.pivotbot.backend.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Market order handed to the exchange. The reference price is the price observed when the
 * order was decided and is used for notional checks and simulated fills. Entry orders carry
 * the stop-loss and take-profit the resulting position will be held to.
 */
public final class Order {
    private final String clientOrderId;
    private final String symbol;
    private final OrderSide side;
    private final OrderType type;
    private final BigDecimal quantity;
    private final BigDecimal referencePrice;
    private final BigDecimal stopLoss;
    private final BigDecimal takeProfit;
    private final DecisionReason reason;

    private Order(String clientOrderId, String symbol, OrderSide side, BigDecimal quantity, BigDecimal referencePrice,
                  BigDecimal stopLoss, BigDecimal takeProfit, DecisionReason reason) {
        this.clientOrderId = Objects.requireNonNull(clientOrderId, "clientOrderId");
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.side = Objects.requireNonNull(side, "side");
        this.type = OrderType.MARKET;
        this.quantity = Objects.requireNonNull(quantity, "quantity");
        this.referencePrice = Objects.requireNonNull(referencePrice, "referencePrice");
        this.stopLoss = stopLoss;
        this.takeProfit = takeProfit;
        this.reason = reason;
        if (quantity.signum() <= 0) {
            throw new IllegalArgumentException("Order quantity must be positive: " + quantity);
        }
    }

    public static Order marketBuy(String clientOrderId, String symbol, BigDecimal quantity, BigDecimal referencePrice,
                                  BigDecimal stopLoss, BigDecimal takeProfit, DecisionReason reason) {
        return new Order(clientOrderId, symbol, OrderSide.BUY, quantity, referencePrice,
                Objects.requireNonNull(stopLoss, "stopLoss"), Objects.requireNonNull(takeProfit, "takeProfit"), reason);
    }

    public static Order marketSell(String clientOrderId, String symbol, BigDecimal quantity, BigDecimal referencePrice,
                                   DecisionReason reason) {
        return new Order(clientOrderId, symbol, OrderSide.SELL, quantity, referencePrice, null, null, reason);
    }

    public String getClientOrderId() {
        return clientOrderId;
    }

    public String getSymbol() {
        return symbol;
    }

    public OrderSide getSide() {
        return side;
    }

    public OrderType getType() {
        return type;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    public BigDecimal getReferencePrice() {
        return referencePrice;
    }

    public BigDecimal getStopLoss() {
        return stopLoss;
    }

    public BigDecimal getTakeProfit() {
        return takeProfit;
    }

    public DecisionReason getReason() {
        return reason;
    }

    public BigDecimal getNotional() {
        return quantity.multiply(referencePrice);
    }

    @Override
    public String toString() {
        return "Order{" + clientOrderId + ' ' + side + ' ' + quantity + ' ' + symbol
                + " @~" + referencePrice + ", reason=" + reason + '}';
    }
}
