package com.pivotbot.backend.exception;

/**
 * The daily trade state could not be written. Trading stays blocked until a write succeeds.
 */
public class TradeStatePersistenceException extends Exception {

    public TradeStatePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
