package com.pivotbot.backend.exception;

import java.math.BigDecimal;

/**
 * Exception thrown when there's insufficient balance for an order.
 */
public class InsufficientBalanceException extends ExchangeException {
    private final String asset;
    private final BigDecimal required;
    private final BigDecimal available;

    public InsufficientBalanceException(String asset, BigDecimal required, BigDecimal available) {
        super(String.format("Insufficient %s balance: required %s, available %s", asset, required, available));
        this.asset = asset;
        this.required = required;
        this.available = available;
    }

    public String getAsset() {
        return asset;
    }

    public BigDecimal getRequired() {
        return required;
    }

    public BigDecimal getAvailable() {
        return available;
    }
}
