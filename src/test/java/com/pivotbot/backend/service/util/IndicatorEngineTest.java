package com.pivotbot.backend.service.util;

import com.pivotbot.backend.exception.InsufficientDataException;
import com.pivotbot.backend.model.Candle;
import com.pivotbot.backend.model.IndicatorSet;
import com.pivotbot.backend.model.PivotLevels;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IndicatorEngineTest {

    private static final double[] WILDER_CLOSES = {
            44.34, 44.09, 44.15, 43.61, 44.33, 44.83, 45.10, 45.42,
            45.84, 46.08, 45.89, 46.03, 45.61, 46.28, 46.28};

    @Test
    void computeSMA_shouldAverageMostRecentCloses() {
        List<Candle> candles = CandleFixtures.hourlyCloses(1, 2, 3, 4, 5);

        BigDecimal sma = IndicatorEngine.computeSMA(candles, 3);

        assertEquals(0, sma.compareTo(BigDecimal.valueOf(4)));
    }

    @Test
    void computeSMA_withFewerCandlesThanPeriod_shouldThrow() {
        List<Candle> candles = CandleFixtures.hourlyCloses(1, 2, 3);

        InsufficientDataException e = assertThrows(InsufficientDataException.class,
                () -> IndicatorEngine.computeSMA(candles, 4));
        assertEquals(4, e.getRequired());
        assertEquals(3, e.getAvailable());
    }

    @Test
    void computeRSI_shouldMatchWilderReferenceValue() {
        BigDecimal rsi = IndicatorEngine.computeRSI(CandleFixtures.hourlyCloses(WILDER_CLOSES), 14);

        assertEquals(70.46, rsi.doubleValue(), 0.01);
    }

    @Test
    void computeRSI_shouldApplyWilderSmoothingToLaterCandles() {
        double[] closes = new double[WILDER_CLOSES.length + 1];
        System.arraycopy(WILDER_CLOSES, 0, closes, 0, WILDER_CLOSES.length);
        closes[WILDER_CLOSES.length] = 46.00;

        BigDecimal rsi = IndicatorEngine.computeRSI(CandleFixtures.hourlyCloses(closes), 14);

        assertEquals(66.25, rsi.doubleValue(), 0.01);
    }

    @Test
    void computeRSI_needsPeriodPlusOneCandles() {
        double[] closes = new double[14];
        System.arraycopy(WILDER_CLOSES, 0, closes, 0, 14);

        assertThrows(InsufficientDataException.class,
                () -> IndicatorEngine.computeRSI(CandleFixtures.hourlyCloses(closes), 14));
    }

    @Test
    void computeRSI_staysWithinBounds() {
        BigDecimal rising = IndicatorEngine.computeRSI(CandleFixtures.hourlyCloses(1, 2, 3, 4, 5, 6), 5);
        BigDecimal falling = IndicatorEngine.computeRSI(CandleFixtures.hourlyCloses(6, 5, 4, 3, 2, 1), 5);
        BigDecimal flat = IndicatorEngine.computeRSI(CandleFixtures.hourlyCloses(3, 3, 3, 3, 3, 3), 5);

        assertEquals(0, rising.compareTo(BigDecimal.valueOf(100)));
        assertEquals(0, falling.compareTo(BigDecimal.ZERO));
        assertEquals(0, flat.compareTo(BigDecimal.valueOf(50)));
    }

    @Test
    void computePivotLevels_shouldUseClassicFormulas() {
        PivotLevels levels = IndicatorEngine.computePivotLevels(
                BigDecimal.valueOf(110), BigDecimal.valueOf(90), BigDecimal.valueOf(100));

        assertEquals(0, levels.getPivot().compareTo(BigDecimal.valueOf(100)));
        assertEquals(0, levels.getResistance1().compareTo(BigDecimal.valueOf(110)));
        assertEquals(0, levels.getResistance2().compareTo(BigDecimal.valueOf(120)));
        assertEquals(0, levels.getSupport1().compareTo(BigDecimal.valueOf(90)));
        assertEquals(0, levels.getSupport2().compareTo(BigDecimal.valueOf(80)));
    }

    @Test
    void computePivotLevels_fromCandles_shouldIgnoreCandleStillForming() {
        Instant start = CandleFixtures.START;
        List<Candle> candles = new ArrayList<>();
        candles.add(CandleFixtures.candle(start, 95, 110, 92, 100));
        candles.add(CandleFixtures.candle(start.plus(Duration.ofHours(1)), 100, 105, 90, 100));
        // forming candle with an extreme high that must not count
        candles.add(CandleFixtures.candle(start.plus(Duration.ofHours(2)), 100, 500, 1, 300));
        Instant now = start.plus(Duration.ofMinutes(150));

        PivotLevels levels = IndicatorEngine.computePivotLevels(candles, now);

        assertEquals(0, levels.getPivot().compareTo(BigDecimal.valueOf(100)));
        assertEquals(0, levels.getResistance2().compareTo(BigDecimal.valueOf(120)));
    }

    @Test
    void computePivotLevels_withoutClosedCandles_shouldThrow() {
        List<Candle> candles = CandleFixtures.hourlyCloses(100);

        assertThrows(InsufficientDataException.class,
                () -> IndicatorEngine.computePivotLevels(candles, CandleFixtures.START.plusSeconds(60)));
    }

    @Test
    void computeIndicators_shouldDetectUpwardCross() {
        List<Candle> candles = CandleFixtures.hourlyCloses(10, 10, 10, 10, 9, 12);

        IndicatorSet set = IndicatorEngine.computeIndicators(candles, 2, 3, 2);

        assertTrue(set.isSmaCrossedUp());
        assertFalse(set.isSmaCrossedDown());
        assertEquals(0, set.getSmaShort().compareTo(new BigDecimal("10.5")));
    }

    @Test
    void computeIndicators_shouldDetectDownwardCross() {
        List<Candle> candles = CandleFixtures.hourlyCloses(10, 10, 10, 10, 11, 8);

        IndicatorSet set = IndicatorEngine.computeIndicators(candles, 2, 3, 2);

        assertTrue(set.isSmaCrossedDown());
        assertFalse(set.isSmaCrossedUp());
    }

    @Test
    void computeIndicators_requiresOneCandleMoreThanLongPeriod() {
        List<Candle> candles = CandleFixtures.hourlyCloses(1, 2, 3);

        assertThrows(InsufficientDataException.class, () -> IndicatorEngine.computeIndicators(candles, 2, 3, 2));
    }
}
