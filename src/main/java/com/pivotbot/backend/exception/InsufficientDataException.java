package com.pivotbot.backend.exception;

/**
 * Thrown when a candle window is too short for the requested indicator.
 */
public class InsufficientDataException extends RuntimeException {
    private final int required;
    private final int available;

    public InsufficientDataException(String indicator, int required, int available) {
        super(indicator + " needs at least " + required + " candles, got " + available);
        this.required = required;
        this.available = available;
    }

    public int getRequired() {
        return required;
    }

    public int getAvailable() {
        return available;
    }
}
