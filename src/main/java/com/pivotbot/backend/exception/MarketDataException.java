package com.pivotbot.backend.exception;

public class MarketDataException extends Exception {

    public MarketDataException(String message) {
        super(message);
    }

    public MarketDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
