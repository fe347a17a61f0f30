package com.pivotbot.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Persisted per-day trade counter. Instances are immutable; every transition returns a new value.
 * {@code count} is authoritative; {@code tradesToday} holds the detail of fills the ledger booked.
 */
public final class DailyTradeState {
    private final LocalDate utcDate;
    private final int count;
    private final LocalDate lastResetDate;
    private final BigDecimal dailyRealizedPnl;
    private final List<TradeRecord> tradesToday;

    public DailyTradeState(LocalDate utcDate, int count, LocalDate lastResetDate, BigDecimal dailyRealizedPnl) {
        this(utcDate, count, lastResetDate, dailyRealizedPnl, null);
    }

    @JsonCreator
    public DailyTradeState(@JsonProperty("utcDate") LocalDate utcDate,
                           @JsonProperty("count") int count,
                           @JsonProperty("lastResetDate") LocalDate lastResetDate,
                           @JsonProperty("dailyRealizedPnl") BigDecimal dailyRealizedPnl,
                           @JsonProperty("tradesToday") List<TradeRecord> tradesToday) {
        if (count < 0) {
            throw new IllegalArgumentException("Trade count cannot be negative: " + count);
        }
        this.utcDate = Objects.requireNonNull(utcDate, "utcDate");
        this.count = count;
        this.lastResetDate = lastResetDate != null ? lastResetDate : utcDate;
        this.dailyRealizedPnl = dailyRealizedPnl != null ? dailyRealizedPnl : BigDecimal.ZERO;
        this.tradesToday = tradesToday != null
                ? Collections.unmodifiableList(new ArrayList<>(tradesToday))
                : Collections.emptyList();
    }

    public static DailyTradeState freshFor(LocalDate date) {
        return new DailyTradeState(date, 0, date, BigDecimal.ZERO);
    }

    /**
     * @param detail the booked fill, or null when the ledger refused it but the venue still executed
     */
    public DailyTradeState withTradeRecorded(BigDecimal realizedPnl, TradeRecord detail) {
        BigDecimal pnl = realizedPnl != null ? realizedPnl : BigDecimal.ZERO;
        List<TradeRecord> trades = new ArrayList<>(tradesToday);
        if (detail != null) {
            trades.add(detail);
        }
        return new DailyTradeState(utcDate, count + 1, lastResetDate, dailyRealizedPnl.add(pnl), trades);
    }

    public DailyTradeState rolledOverTo(LocalDate date) {
        return freshFor(date);
    }

    public LocalDate getUtcDate() {
        return utcDate;
    }

    public int getCount() {
        return count;
    }

    public LocalDate getLastResetDate() {
        return lastResetDate;
    }

    public BigDecimal getDailyRealizedPnl() {
        return dailyRealizedPnl;
    }

    public List<TradeRecord> getTradesToday() {
        return tradesToday;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DailyTradeState)) {
            return false;
        }
        DailyTradeState that = (DailyTradeState) o;
        return count == that.count
                && utcDate.equals(that.utcDate)
                && lastResetDate.equals(that.lastResetDate)
                && dailyRealizedPnl.compareTo(that.dailyRealizedPnl) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(utcDate, count, lastResetDate, dailyRealizedPnl.stripTrailingZeros());
    }

    @Override
    public String toString() {
        return "DailyTradeState{date=" + utcDate + ", count=" + count
                + ", lastReset=" + lastResetDate + ", dailyPnl=" + dailyRealizedPnl + '}';
    }
}
