package com.pivotbot.backend.service;

import com.pivotbot.backend.config.TradingProperties;
import com.pivotbot.backend.exception.ExchangeException;
import com.pivotbot.backend.exception.RateLimitException;
import com.pivotbot.backend.exception.TradeStatePersistenceException;
import com.pivotbot.backend.model.AdvisorRecommendation;
import com.pivotbot.backend.model.CycleOutcome;
import com.pivotbot.backend.model.Decision;
import com.pivotbot.backend.model.DecisionContext;
import com.pivotbot.backend.model.DecisionReason;
import com.pivotbot.backend.model.DecisionState;
import com.pivotbot.backend.model.ExecutionResult;
import com.pivotbot.backend.model.Fill;
import com.pivotbot.backend.model.IndicatorSet;
import com.pivotbot.backend.model.Order;
import com.pivotbot.backend.model.Position;
import com.pivotbot.backend.model.TradeDecision;
import com.pivotbot.backend.model.TradeRecord;
import com.pivotbot.backend.service.exchange.Exchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs the trading state machine for one cycle and carries out its decision: the trade limiter is
 * consulted and checkpointed before any order, the ledger and the limiter are updated only after a
 * confirmed fill.
 */
@Service
public class DecisionEngine {

    private static final Logger logger = LoggerFactory.getLogger(DecisionEngine.class);

    private static final int QUANTITY_SCALE = 8;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final TradingStateMachine stateMachine;
    private final TradeLimiter tradeLimiter;
    private final PortfolioLedger ledger;
    private final Exchange exchange;
    private final TradingProperties properties;
    private final Clock clock;
    private final AtomicLong orderSequence = new AtomicLong();

    private DecisionState state;

    @Autowired
    public DecisionEngine(TradingStateMachine stateMachine, TradeLimiter tradeLimiter, PortfolioLedger ledger,
                          Exchange exchange, TradingProperties properties, Clock clock) {
        this.stateMachine = stateMachine;
        this.tradeLimiter = tradeLimiter;
        this.ledger = ledger;
        this.exchange = exchange;
        this.properties = properties;
        this.clock = clock;
        this.state = ledger.hasOpenPosition() ? DecisionState.POSITION_OPEN : DecisionState.IDLE;
    }

    public synchronized DecisionState getState() {
        return state;
    }

    /**
     * Evaluates and, if the decision is an order, executes it.
     *
     * @param deadline instant after which no order may be sent; the cycle is abandoned instead
     */
    public synchronized ExecutionResult execute(BigDecimal currentPrice, IndicatorSet indicators,
                                                AdvisorRecommendation recommendation, Instant now, Instant deadline) {
        Position position = ledger.getPosition();
        state = position != null ? DecisionState.POSITION_OPEN : DecisionState.IDLE;
        DecisionState before = state;

        boolean tradingAllowed = tradeLimiter.canTrade(now);
        Decision decision = stateMachine.evaluate(state,
                new DecisionContext(currentPrice, indicators, recommendation, position, tradingAllowed));

        if (!decision.isOrder()) {
            if (decision.getReason() == DecisionReason.DAILY_LIMIT && !tradeLimiter.isPersistenceHealthy()) {
                return hold(before, DecisionReason.PERSISTENCE_FAILURE, CycleOutcome.HOLD, "Trade state not persisted, trading blocked");
            }
            return hold(before, decision.getReason(), CycleOutcome.HOLD, null);
        }

        Order order;
        if (decision.getAction() == TradeDecision.BUY) {
            order = buildEntryOrder(currentPrice, recommendation, decision.getReason());
            if (order == null) {
                return hold(before, DecisionReason.BELOW_MIN_NOTIONAL, CycleOutcome.HOLD,
                        "Entry below minimum notional " + properties.getMinNotional());
            }
        } else {
            order = Order.marketSell(nextOrderId(), properties.getSymbol(), position.getQuantity(), currentPrice, decision.getReason());
        }

        try {
            tradeLimiter.checkpoint();
        } catch (TradeStatePersistenceException e) {
            logger.error("Not sending {}: trade state cannot be written ({})", order, e.getMessage());
            return result(before, decision, DecisionReason.PERSISTENCE_FAILURE, CycleOutcome.NOT_EXECUTED, order, null, null,
                    e.getMessage());
        }

        if (clock.instant().isAfter(deadline)) {
            logger.warn("Cycle deadline passed before sending {}, abandoning", order);
            return result(before, decision, decision.getReason(), CycleOutcome.ABANDONED, order, null, null,
                    "Cycle deadline passed");
        }

        // the cycle may have crossed UTC midnight since the first check
        if (!tradeLimiter.canTrade(clock.instant())) {
            logger.warn("Daily trade cap reached before sending {}, not sending", order);
            return result(before, decision, DecisionReason.DAILY_LIMIT, CycleOutcome.NOT_EXECUTED, order, null, null,
                    "Daily trade cap reached");
        }

        Fill fill;
        try {
            fill = exchange.placeOrder(order);
        } catch (RateLimitException e) {
            logger.warn("{} rate-limited {} (retry after {}ms)", exchange.getExchangeName(), order, e.getRetryAfterMs());
            return result(before, decision, DecisionReason.EXCHANGE_REJECTED, CycleOutcome.NOT_EXECUTED, order, null, null,
                    e.getMessage());
        } catch (ExchangeException e) {
            logger.warn("{} did not execute {}: {}", exchange.getExchangeName(), order, e.getMessage());
            return result(before, decision, DecisionReason.EXCHANGE_REJECTED, CycleOutcome.NOT_EXECUTED, order, null, null,
                    e.getMessage());
        }

        logger.info("{} {} filled: {} {} @ {} ({})", decision.getAction(), properties.getSymbol(),
                fill.getOrderId(), fill.getQuantity(), fill.getPrice(), decision.getReason());

        TradeRecord record = null;
        String message = null;
        try {
            record = ledger.applyFill(order, fill);
            state = decision.getNextStateOnFill();
        } catch (IllegalStateException e) {
            message = "Ledger refused fill " + fill.getOrderId() + ": " + e.getMessage();
            logger.error(message);
        }

        BigDecimal realized = record != null ? record.getRealizedPnl() : BigDecimal.ZERO;
        try {
            tradeLimiter.recordTrade(order.getSide(), realized, record);
        } catch (TradeStatePersistenceException e) {
            logger.error("Fill {} counted in memory only, trading blocked until the state is written: {}",
                    fill.getOrderId(), e.getMessage());
            message = message == null ? e.getMessage() : message + "; " + e.getMessage();
        }

        return result(before, decision, decision.getReason(), CycleOutcome.EXECUTED, order, fill, record, message);
    }

    /**
     * Sizes an entry as positionFraction of the free quote balance. Returns null when the order
     * would be below the minimum notional.
     */
    private Order buildEntryOrder(BigDecimal price, AdvisorRecommendation recommendation, DecisionReason reason) {
        BigDecimal available = ledger.balanceOf(properties.getQuoteAsset());
        BigDecimal quantity = available.multiply(properties.getPositionFraction(), MathContext.DECIMAL64)
                .divide(price, QUANTITY_SCALE, RoundingMode.DOWN);
        if (quantity.signum() <= 0 || quantity.multiply(price).compareTo(properties.getMinNotional()) < 0) {
            logger.info("Entry of {} {} at {} is below minimum notional {}", quantity, properties.getBaseAsset(),
                    price, properties.getMinNotional());
            return null;
        }
        BigDecimal stopLoss = protectiveStopLoss(price, recommendation.getStopLoss());
        BigDecimal takeProfit = protectiveTakeProfit(price, recommendation.getTakeProfit());
        return Order.marketBuy(nextOrderId(), properties.getSymbol(), quantity, price, stopLoss, takeProfit, reason);
    }

    BigDecimal protectiveStopLoss(BigDecimal entry, BigDecimal advised) {
        if (advised != null && advised.signum() > 0 && advised.compareTo(entry) < 0) {
            return advised;
        }
        return percentOf(entry, properties.getStopLossPercent());
    }

    BigDecimal protectiveTakeProfit(BigDecimal entry, BigDecimal advised) {
        if (advised != null && advised.compareTo(entry) > 0) {
            return advised;
        }
        return percentOf(entry, properties.getTakeProfitPercent());
    }

    private static BigDecimal percentOf(BigDecimal entry, BigDecimal percent) {
        return entry.multiply(BigDecimal.ONE.add(percent.divide(HUNDRED, MathContext.DECIMAL64)), MathContext.DECIMAL64);
    }

    private String nextOrderId() {
        return "pb-" + clock.millis() + "-" + orderSequence.incrementAndGet();
    }

    private ExecutionResult hold(DecisionState before, DecisionReason reason, CycleOutcome outcome, String message) {
        return ExecutionResult.builder()
                .stateBefore(before)
                .stateAfter(state)
                .action(TradeDecision.HOLD)
                .reason(reason)
                .outcome(outcome)
                .message(message)
                .build();
    }

    private ExecutionResult result(DecisionState before, Decision decision, DecisionReason reason, CycleOutcome outcome,
                                   Order order, Fill fill, TradeRecord record, String message) {
        return ExecutionResult.builder()
                .stateBefore(before)
                .stateAfter(state)
                .action(outcome == CycleOutcome.EXECUTED ? decision.getAction() : TradeDecision.HOLD)
                .reason(reason)
                .outcome(outcome)
                .order(order)
                .fill(fill)
                .tradeRecord(record)
                .message(message)
                .build();
    }
}
