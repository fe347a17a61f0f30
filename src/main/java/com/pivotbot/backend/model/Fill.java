package com.pivotbot.backend.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Exchange confirmation that an order executed.
 */
public final class Fill {
    private final String orderId;
    private final BigDecimal price;
    private final BigDecimal quantity;
    private final BigDecimal fee;
    private final Instant timestamp;

    public Fill(String orderId, BigDecimal price, BigDecimal quantity, BigDecimal fee, Instant timestamp) {
        this.orderId = Objects.requireNonNull(orderId, "orderId");
        this.price = Objects.requireNonNull(price, "price");
        this.quantity = Objects.requireNonNull(quantity, "quantity");
        this.fee = fee != null ? fee : BigDecimal.ZERO;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    public String getOrderId() {
        return orderId;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    public BigDecimal getFee() {
        return fee;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "Fill{" + orderId + ' ' + quantity + " @" + price + '}';
    }
}
