package com.pivotbot.backend.service.marketdata;

import com.pivotbot.backend.exception.MarketDataException;
import com.pivotbot.backend.model.MarketSnapshot;

/**
 * Supplies hourly candle windows and the current price for a symbol.
 */
public interface MarketDataSource {

    String getSourceName();

    MarketSnapshot snapshot(String symbol) throws MarketDataException;
}
