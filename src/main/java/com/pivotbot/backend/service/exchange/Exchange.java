package com.pivotbot.backend.service.exchange;

import com.pivotbot.backend.exception.ExchangeException;
import com.pivotbot.backend.model.Fill;
import com.pivotbot.backend.model.Order;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Order execution venue. Any exception from {@link #placeOrder(Order)} means the order did not execute.
 */
public interface Exchange {

    String getExchangeName();

    /**
     * Submits a market order and waits for its fill.
     *
     * @throws com.pivotbot.backend.exception.InsufficientBalanceException if the account cannot cover the order
     * @throws com.pivotbot.backend.exception.RateLimitException if the venue throttled the request
     * @throws com.pivotbot.backend.exception.OrderRejectedException if the venue refused the order
     * @throws ExchangeException if the venue could not be reached
     */
    Fill placeOrder(Order order) throws ExchangeException;

    /**
     * Free balances per asset as the venue reports them.
     */
    Map<String, BigDecimal> getBalances() throws ExchangeException;
}
