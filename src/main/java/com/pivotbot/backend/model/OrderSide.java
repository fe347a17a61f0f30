package com.pivotbot.backend.model;

public enum OrderSide {
    BUY,
    SELL
}
