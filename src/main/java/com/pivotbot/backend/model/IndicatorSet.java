package com.pivotbot.backend.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Indicator values derived for a single cycle. The previous-bar SMA values are kept so a
 * crossover between the last two bars can be detected.
 */
public final class IndicatorSet {
    private final BigDecimal smaShort;
    private final BigDecimal smaLong;
    private final BigDecimal previousSmaShort;
    private final BigDecimal previousSmaLong;
    private final BigDecimal rsi;

    public IndicatorSet(BigDecimal smaShort, BigDecimal smaLong, BigDecimal previousSmaShort,
                        BigDecimal previousSmaLong, BigDecimal rsi) {
        this.smaShort = Objects.requireNonNull(smaShort);
        this.smaLong = Objects.requireNonNull(smaLong);
        this.previousSmaShort = Objects.requireNonNull(previousSmaShort);
        this.previousSmaLong = Objects.requireNonNull(previousSmaLong);
        this.rsi = Objects.requireNonNull(rsi);
    }

    public BigDecimal getSmaShort() {
        return smaShort;
    }

    public BigDecimal getSmaLong() {
        return smaLong;
    }

    public BigDecimal getPreviousSmaShort() {
        return previousSmaShort;
    }

    public BigDecimal getPreviousSmaLong() {
        return previousSmaLong;
    }

    public BigDecimal getRsi() {
        return rsi;
    }

    /** Short SMA was at or below the long SMA on the previous bar and is above it now. */
    public boolean isSmaCrossedUp() {
        return previousSmaShort.compareTo(previousSmaLong) <= 0 && smaShort.compareTo(smaLong) > 0;
    }

    /** Short SMA was at or above the long SMA on the previous bar and is below it now. */
    public boolean isSmaCrossedDown() {
        return previousSmaShort.compareTo(previousSmaLong) >= 0 && smaShort.compareTo(smaLong) < 0;
    }

    public boolean isBullishTrend() {
        return smaShort.compareTo(smaLong) > 0;
    }

    @Override
    public String toString() {
        return "IndicatorSet{smaShort=" + smaShort + ", smaLong=" + smaLong + ", rsi=" + rsi
                + ", crossedUp=" + isSmaCrossedUp() + ", crossedDown=" + isSmaCrossedDown() + '}';
    }
}
