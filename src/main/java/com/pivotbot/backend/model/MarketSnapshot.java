package com.pivotbot.backend.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Everything the decision cycle knows about the market at one instant.
 * Rebuilt every cycle and discarded afterwards.
 */
public final class MarketSnapshot {
    private final String symbol;
    private final List<Candle> candles12h;
    private final List<Candle> candles24h;
    private final List<Candle> candles48h;
    private final BigDecimal currentPrice;
    private final Instant capturedAt;

    public MarketSnapshot(String symbol, List<Candle> candles12h, List<Candle> candles24h,
                          List<Candle> candles48h, BigDecimal currentPrice, Instant capturedAt) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.candles12h = List.copyOf(candles12h);
        this.candles24h = List.copyOf(candles24h);
        this.candles48h = List.copyOf(candles48h);
        this.currentPrice = Objects.requireNonNull(currentPrice, "currentPrice");
        this.capturedAt = Objects.requireNonNull(capturedAt, "capturedAt");
    }

    /**
     * Builds the 12h/24h/48h windows from one hourly series (oldest first) by open time relative to {@code now}.
     */
    public static MarketSnapshot fromHourlyCandles(String symbol, List<Candle> hourly, BigDecimal currentPrice, Instant now) {
        return new MarketSnapshot(symbol,
                window(hourly, now, 12),
                window(hourly, now, 24),
                window(hourly, now, 48),
                currentPrice, now);
    }

    private static List<Candle> window(List<Candle> hourly, Instant now, int hours) {
        Instant from = now.minus(Duration.ofHours(hours));
        List<Candle> result = new ArrayList<>();
        for (Candle candle : hourly) {
            if (!candle.getOpenTime().isBefore(from)) {
                result.add(candle);
            }
        }
        return result;
    }

    public String getSymbol() {
        return symbol;
    }

    public List<Candle> getCandles12h() {
        return candles12h;
    }

    public List<Candle> getCandles24h() {
        return candles24h;
    }

    public List<Candle> getCandles48h() {
        return candles48h;
    }

    public BigDecimal getCurrentPrice() {
        return currentPrice;
    }

    public Instant getCapturedAt() {
        return capturedAt;
    }

    public BigDecimal getHigh24h() {
        return highOf(candles24h);
    }

    public BigDecimal getLow24h() {
        return lowOf(candles24h);
    }

    public BigDecimal getHigh12h() {
        return highOf(candles12h);
    }

    public BigDecimal getLow12h() {
        return lowOf(candles12h);
    }

    public BigDecimal getHigh48h() {
        return highOf(candles48h);
    }

    public BigDecimal getLow48h() {
        return lowOf(candles48h);
    }

    /**
     * Percent change between the first open of the 24h window and the current price,
     * or zero when the window is empty.
     */
    public BigDecimal getPriceChange24hPercent() {
        if (candles24h.isEmpty() || candles24h.get(0).getOpen().signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal first = candles24h.get(0).getOpen();
        return currentPrice.subtract(first)
                .divide(first, MathContext.DECIMAL64)
                .multiply(BigDecimal.valueOf(100));
    }

    private static BigDecimal highOf(List<Candle> candles) {
        return candles.isEmpty() ? null
                : Collections.max(candles, Comparator.comparing(Candle::getHigh)).getHigh();
    }

    private static BigDecimal lowOf(List<Candle> candles) {
        return candles.isEmpty() ? null
                : Collections.min(candles, Comparator.comparing(Candle::getLow)).getLow();
    }
}
