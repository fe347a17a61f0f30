package com.pivotbot.backend.exception;

public class OrderRejectedException extends ExchangeException {
    private final String rejectReason;

    public OrderRejectedException(String message, String rejectReason) {
        super(message + ": " + rejectReason);
        this.rejectReason = rejectReason;
    }

    public String getRejectReason() {
        return rejectReason;
    }
}
