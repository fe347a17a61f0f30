package com.pivotbot.backend.service;

import com.pivotbot.backend.config.TradingProperties;
import com.pivotbot.backend.exception.TradeStatePersistenceException;
import com.pivotbot.backend.model.DailyTradeState;
import com.pivotbot.backend.model.LimiterStatus;
import com.pivotbot.backend.model.OrderSide;
import com.pivotbot.backend.model.TradeRecord;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.Optional;

/**
 * Caps the number of trades per UTC calendar day and keeps the counter on disk so a restart
 * cannot hand out a fresh allowance.
 */
@Service
public class TradeLimiter {

    private static final Logger logger = LoggerFactory.getLogger(TradeLimiter.class);

    private final TradeStateStore store;
    private final int maxTradesPerDay;
    private final Clock clock;

    private DailyTradeState state;
    // false while the last write failed; trading stays blocked until a write succeeds
    private boolean persistenceHealthy;

    @Autowired
    public TradeLimiter(TradeStateStore store, TradingProperties properties, Clock clock) {
        this(store, properties.getMaxTradesPerDay(), clock);
    }

    public TradeLimiter(TradeStateStore store, int maxTradesPerDay, Clock clock) {
        if (maxTradesPerDay < 1) {
            throw new IllegalArgumentException("maxTradesPerDay must be at least 1: " + maxTradesPerDay);
        }
        this.store = store;
        this.maxTradesPerDay = maxTradesPerDay;
        this.clock = clock;
    }

    @PostConstruct
    public synchronized void load() {
        LocalDate today = utcDate(clock.instant());
        try {
            Optional<DailyTradeState> stored = store.load();
            if (stored.isPresent()) {
                state = stored.get();
                persistenceHealthy = true;
                logger.info("Loaded trade state from {}: {}", store.getStateFile(), state);
                resetIfNewDay(clock.instant());
                return;
            }
            state = DailyTradeState.freshFor(today);
            logger.info("No trade state at {}, starting fresh for {}", store.getStateFile(), today);
        } catch (IOException e) {
            // cap reached until tomorrow
            state = new DailyTradeState(today, maxTradesPerDay, today, BigDecimal.ZERO);
            logger.error("Trade state file {} is unreadable, blocking trading for {}: {}",
                    store.getStateFile(), today, e.getMessage());
        }
        try {
            checkpoint();
        } catch (TradeStatePersistenceException e) {
            logger.error("Initial trade state write failed, trading blocked: {}", e.getMessage());
        }
    }

    /**
     * True iff today's count is below the cap and the state on disk matches memory.
     */
    public synchronized boolean canTrade(Instant now) {
        resetIfNewDay(now);
        return persistenceHealthy && state.getCount() < maxTradesPerDay;
    }

    /**
     * Starts a new day when the UTC date of {@code now} is after the last reset date.
     * A clock that moves backwards never resets.
     *
     * @return true if a reset happened
     */
    public synchronized boolean resetIfNewDay(Instant now) {
        LocalDate today = utcDate(now);
        if (!today.isAfter(state.getLastResetDate())) {
            return false;
        }
        DailyTradeState rolled = state.rolledOverTo(today);
        try {
            store.save(rolled);
            logger.info("New UTC day {}: trade count reset (previous day {} trades, P&L {})",
                    today, state.getCount(), state.getDailyRealizedPnl());
            state = rolled;
            persistenceHealthy = true;
            return true;
        } catch (TradeStatePersistenceException e) {
            persistenceHealthy = false;
            logger.error("Could not persist day rollover to {}: {}", today, e.getMessage());
            return false;
        }
    }

    /**
     * Counts a filled order against the UTC day in which it is recorded, rolling over first if that
     * day has already started. Memory is updated even if the write fails, since the fill happened;
     * trading is then blocked until {@link #checkpoint()} succeeds.
     */
    public synchronized void recordTrade(OrderSide side, BigDecimal realizedPnl) throws TradeStatePersistenceException {
        recordTrade(side, realizedPnl, null);
    }

    /**
     * As {@link #recordTrade(OrderSide, BigDecimal)}, keeping the booked fill in today's trade list.
     */
    public synchronized void recordTrade(OrderSide side, BigDecimal realizedPnl, TradeRecord detail)
            throws TradeStatePersistenceException {
        resetIfNewDay(clock.instant());
        if (state.getCount() >= maxTradesPerDay) {
            throw new IllegalStateException("Daily trade cap of " + maxTradesPerDay + " already reached");
        }
        state = state.withTradeRecorded(realizedPnl, detail);
        logger.info("Recorded {} trade {}/{} for {} (realized P&L {})",
                side, state.getCount(), maxTradesPerDay, state.getUtcDate(), realizedPnl);
        try {
            store.save(state);
            persistenceHealthy = true;
        } catch (TradeStatePersistenceException e) {
            persistenceHealthy = false;
            throw e;
        }
    }

    /**
     * Rewrites the current state. Called before an order is sent to prove the state file is writable.
     */
    public synchronized void checkpoint() throws TradeStatePersistenceException {
        try {
            store.save(state);
            persistenceHealthy = true;
        } catch (TradeStatePersistenceException e) {
            persistenceHealthy = false;
            throw e;
        }
    }

    public synchronized LimiterStatus status(Instant now) {
        LocalDate today = utcDate(now);
        LocalDate stateDay = state.getUtcDate();
        // a new day that has not been rolled over yet already has its full allowance
        boolean pendingReset = today.isAfter(state.getLastResetDate());
        int executed = pendingReset ? 0 : state.getCount();
        LocalDate effectiveDay = pendingReset ? today : stateDay;
        return LimiterStatus.builder()
                .utcDate(effectiveDay)
                .tradesExecuted(executed)
                .tradesRemaining(Math.max(0, maxTradesPerDay - executed))
                .maxTradesPerDay(maxTradesPerDay)
                .dailyRealizedPnl(pendingReset ? BigDecimal.ZERO : state.getDailyRealizedPnl())
                .nextResetAt(effectiveDay.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant())
                .persistenceHealthy(persistenceHealthy)
                .tradesToday(pendingReset ? Collections.emptyList() : state.getTradesToday())
                .build();
    }

    public synchronized DailyTradeState getState() {
        return state;
    }

    public synchronized boolean isPersistenceHealthy() {
        return persistenceHealthy;
    }

    public int getMaxTradesPerDay() {
        return maxTradesPerDay;
    }

    private static LocalDate utcDate(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC);
    }
}
