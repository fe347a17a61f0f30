package com.pivotbot.backend.model;

/**
 * Only market orders are supported.
 */
public enum OrderType {
    MARKET
}
