package com.pivotbot.backend.service.util;

import com.pivotbot.backend.exception.InsufficientDataException;
import com.pivotbot.backend.model.Candle;
import com.pivotbot.backend.model.IndicatorSet;
import com.pivotbot.backend.model.PivotLevels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Utility class for the indicator calculations a trading cycle needs.
 * All methods are pure and operate on candles ordered oldest first.
 */
public final class IndicatorEngine {

    private static final Logger logger = LoggerFactory.getLogger(IndicatorEngine.class);

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal THREE = BigDecimal.valueOf(3);
    private static final BigDecimal NEUTRAL_RSI = BigDecimal.valueOf(50);

    private IndicatorEngine() {
    }

    /**
     * Calculates a simple moving average over the closes of the most recent {@code period} candles.
     *
     * @param candles candle history (oldest first)
     * @param period  number of candles to average
     * @return the SMA value
     * @throws InsufficientDataException if fewer than {@code period} candles are available
     */
    public static BigDecimal computeSMA(List<Candle> candles, int period) {
        requirePositive(period);
        int size = candles == null ? 0 : candles.size();
        if (size < period) {
            logger.debug("SMA({}): not enough candles ({})", period, size);
            throw new InsufficientDataException("SMA(" + period + ")", period, size);
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (Candle candle : candles.subList(size - period, size)) {
            sum = sum.add(candle.getClose(), MC);
        }
        return sum.divide(BigDecimal.valueOf(period), MC);
    }

    /**
     * Calculates the Relative Strength Index with Wilder smoothing. The first average gain/loss is the
     * simple mean of the first {@code period} changes; every later change is folded in as
     * {@code avg = (avg * (period - 1) + current) / period}.
     *
     * @param candles candle history (oldest first)
     * @param period  RSI period, typically 14
     * @return RSI in [0, 100]
     * @throws InsufficientDataException if fewer than {@code period + 1} candles are available
     */
    public static BigDecimal computeRSI(List<Candle> candles, int period) {
        requirePositive(period);
        int size = candles == null ? 0 : candles.size();
        if (size < period + 1) {
            logger.debug("RSI({}): not enough candles ({}), need {}", period, size, period + 1);
            throw new InsufficientDataException("RSI(" + period + ")", period + 1, size);
        }

        BigDecimal periodValue = BigDecimal.valueOf(period);
        BigDecimal avgGain = BigDecimal.ZERO;
        BigDecimal avgLoss = BigDecimal.ZERO;

        for (int i = 1; i <= period; i++) {
            BigDecimal change = candles.get(i).getClose().subtract(candles.get(i - 1).getClose(), MC);
            if (change.signum() > 0) {
                avgGain = avgGain.add(change, MC);
            } else {
                avgLoss = avgLoss.add(change.negate(), MC);
            }
        }
        avgGain = avgGain.divide(periodValue, MC);
        avgLoss = avgLoss.divide(periodValue, MC);

        BigDecimal weight = BigDecimal.valueOf(period - 1L);
        for (int i = period + 1; i < size; i++) {
            BigDecimal change = candles.get(i).getClose().subtract(candles.get(i - 1).getClose(), MC);
            BigDecimal gain = change.signum() > 0 ? change : BigDecimal.ZERO;
            BigDecimal loss = change.signum() < 0 ? change.negate() : BigDecimal.ZERO;
            avgGain = avgGain.multiply(weight, MC).add(gain, MC).divide(periodValue, MC);
            avgLoss = avgLoss.multiply(weight, MC).add(loss, MC).divide(periodValue, MC);
        }

        if (avgLoss.signum() == 0) {
            // flat series has no direction
            return avgGain.signum() == 0 ? NEUTRAL_RSI : HUNDRED;
        }
        BigDecimal rs = avgGain.divide(avgLoss, MC);
        return HUNDRED.subtract(HUNDRED.divide(BigDecimal.ONE.add(rs, MC), MC), MC);
    }

    /**
     * Classic pivot levels from a prior period's high, low and close.
     */
    public static PivotLevels computePivotLevels(BigDecimal high, BigDecimal low, BigDecimal close) {
        if (high.compareTo(low) < 0) {
            throw new IllegalArgumentException("High " + high + " is below low " + low);
        }
        BigDecimal pivot = high.add(low, MC).add(close, MC).divide(THREE, MC);
        BigDecimal range = high.subtract(low, MC);
        BigDecimal doublePivot = pivot.multiply(TWO, MC);
        return new PivotLevels(
                pivot,
                doublePivot.subtract(low, MC),
                pivot.add(range, MC),
                doublePivot.subtract(high, MC),
                pivot.subtract(range, MC));
    }

    /**
     * Pivot levels over the candles of a window that had closed by {@code now}.
     *
     * @throws InsufficientDataException if no candle in the window has closed yet
     */
    public static PivotLevels computePivotLevels(List<Candle> candles, Instant now) {
        List<Candle> closed = closedCandles(candles, now);
        if (closed.isEmpty()) {
            throw new InsufficientDataException("Pivot levels", 1, 0);
        }
        BigDecimal high = closed.get(0).getHigh();
        BigDecimal low = closed.get(0).getLow();
        for (Candle candle : closed) {
            if (candle.getHigh().compareTo(high) > 0) {
                high = candle.getHigh();
            }
            if (candle.getLow().compareTo(low) < 0) {
                low = candle.getLow();
            }
        }
        BigDecimal close = closed.get(closed.size() - 1).getClose();
        return computePivotLevels(high, low, close);
    }

    /**
     * Drops candles whose close time lies after {@code now}.
     */
    public static List<Candle> closedCandles(List<Candle> candles, Instant now) {
        List<Candle> closed = new ArrayList<>();
        if (candles == null) {
            return closed;
        }
        for (Candle candle : candles) {
            if (candle.isClosedAt(now)) {
                closed.add(candle);
            }
        }
        return closed;
    }

    /**
     * Computes the cycle's indicator set. The previous-bar SMAs are taken over the same series
     * without its last candle, so {@code longPeriod + 1} candles are required.
     */
    public static IndicatorSet computeIndicators(List<Candle> candles, int shortPeriod, int longPeriod, int rsiPeriod) {
        int size = candles == null ? 0 : candles.size();
        int required = Math.max(Math.max(shortPeriod, longPeriod) + 1, rsiPeriod + 1);
        if (size < required) {
            throw new InsufficientDataException("Indicator set", required, size);
        }
        List<Candle> previous = candles.subList(0, size - 1);
        return new IndicatorSet(
                computeSMA(candles, shortPeriod),
                computeSMA(candles, longPeriod),
                computeSMA(previous, shortPeriod),
                computeSMA(previous, longPeriod),
                computeRSI(candles, rsiPeriod));
    }

    private static void requirePositive(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("Period must be positive: " + period);
        }
    }
}
