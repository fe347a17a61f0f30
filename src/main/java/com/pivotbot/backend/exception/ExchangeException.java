package com.pivotbot.backend.exception;

/**
 * Base exception for exchange operations. A plain instance means the exchange could not be reached.
 */
public class ExchangeException extends Exception {

    public ExchangeException(String message) {
        super(message);
    }

    public ExchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
