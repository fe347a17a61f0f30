package com.pivotbot.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pivotbot.backend.config.TradingProperties;
import com.pivotbot.backend.exception.OrderRejectedException;
import com.pivotbot.backend.exception.RateLimitException;
import com.pivotbot.backend.model.AdvisorAction;
import com.pivotbot.backend.model.AdvisorRecommendation;
import com.pivotbot.backend.model.CycleOutcome;
import com.pivotbot.backend.model.DecisionReason;
import com.pivotbot.backend.model.DecisionState;
import com.pivotbot.backend.model.ExecutionResult;
import com.pivotbot.backend.model.Fill;
import com.pivotbot.backend.model.Order;
import com.pivotbot.backend.model.RecommendationSource;
import com.pivotbot.backend.model.TradeDecision;
import com.pivotbot.backend.service.exchange.Exchange;
import com.pivotbot.backend.service.exchange.SimulatedExchange;
import com.pivotbot.backend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;

import static com.pivotbot.backend.support.Recommendations.neutralIndicators;
import static com.pivotbot.backend.support.Recommendations.of;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DecisionEngineTest {

    private static final Instant NOW = Instant.parse("2026-10-19T08:00:00Z");
    private static final Instant DEADLINE = NOW.plusSeconds(150);
    private static final BigDecimal PRICE = new BigDecimal("100");

    @TempDir
    Path tempDir;

    @Mock
    private Exchange mockExchange;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private TradingProperties properties;
    private ObjectMapper objectMapper;
    private PortfolioLedger ledger;
    private TradeLimiter limiter;

    @BeforeEach
    void setUp() {
        properties = new TradingProperties();
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        ledger = new PortfolioLedger(properties, clock);
        ledger.seedBalances(Map.of("USDT", new BigDecimal("10000"), "BTC", BigDecimal.ZERO));
        limiter = newLimiter(tempDir.resolve("trade_state.json"));
    }

    private TradeLimiter newLimiter(Path stateFile) {
        TradeLimiter tradeLimiter = new TradeLimiter(new TradeStateStore(objectMapper, stateFile), 2, clock);
        tradeLimiter.load();
        return tradeLimiter;
    }

    private DecisionEngine engine(Exchange exchange) {
        return new DecisionEngine(new TradingStateMachine(properties), limiter, ledger, exchange, properties, clock);
    }

    private static ExecutionResult run(DecisionEngine engine, String price, AdvisorAction advice) {
        return engine.execute(new BigDecimal(price), neutralIndicators(), of(advice), NOW, DEADLINE);
    }

    @Test
    void execute_shouldNeverSendThirdOrderOnSameDay() {
        DecisionEngine engine = engine(new SimulatedExchange(properties, clock));

        ExecutionResult entry = run(engine, "100", AdvisorAction.STRONG_BUY);
        ExecutionResult exit = run(engine, "125", AdvisorAction.HOLD);
        ExecutionResult third = run(engine, "100", AdvisorAction.STRONG_BUY);

        assertEquals(CycleOutcome.EXECUTED, entry.getOutcome());
        assertEquals(DecisionState.POSITION_OPEN, entry.getStateAfter());
        assertEquals(CycleOutcome.EXECUTED, exit.getOutcome());
        assertEquals(DecisionReason.TAKE_PROFIT, exit.getReason());
        assertEquals(DecisionState.IDLE, exit.getStateAfter());

        assertEquals(TradeDecision.HOLD, third.getAction());
        assertEquals(DecisionReason.DAILY_LIMIT, third.getReason());
        assertNull(third.getOrder());
        assertEquals(2, limiter.getState().getCount());
        assertEquals(2, ledger.getTrades().size());
    }

    @Test
    void execute_whenFillLandsAfterUtcMidnight_shouldChargeItToTheNewDay() throws Exception {
        MutableClock midnight = new MutableClock(Instant.parse("2026-10-19T23:59:59.900Z"));
        Instant afterMidnight = Instant.parse("2026-10-20T00:00:01Z");
        ledger = new PortfolioLedger(properties, midnight);
        ledger.seedBalances(Map.of("USDT", new BigDecimal("10000"), "BTC", BigDecimal.ZERO));
        limiter = new TradeLimiter(new TradeStateStore(objectMapper, tempDir.resolve("midnight.json")), 2, midnight);
        limiter.load();
        SimulatedExchange venue = new SimulatedExchange(properties, midnight);
        when(mockExchange.placeOrder(any(Order.class))).thenAnswer(invocation -> {
            midnight.set(afterMidnight);
            return venue.placeOrder(invocation.getArgument(0));
        });
        DecisionEngine engine = new DecisionEngine(new TradingStateMachine(properties), limiter, ledger, mockExchange,
                properties, midnight);

        ExecutionResult entry = engine.execute(PRICE, neutralIndicators(), of(AdvisorAction.STRONG_BUY),
                midnight.instant(), midnight.instant().plusSeconds(150));
        ExecutionResult exit = engine.execute(new BigDecimal("125"), neutralIndicators(), of(AdvisorAction.HOLD),
                midnight.instant(), midnight.instant().plusSeconds(150));
        ExecutionResult third = engine.execute(PRICE, neutralIndicators(), of(AdvisorAction.STRONG_BUY),
                midnight.instant(), midnight.instant().plusSeconds(150));

        assertEquals(CycleOutcome.EXECUTED, entry.getOutcome());
        assertEquals(CycleOutcome.EXECUTED, exit.getOutcome());
        assertEquals(TradeDecision.HOLD, third.getAction());
        assertEquals(DecisionReason.DAILY_LIMIT, third.getReason());
        assertEquals(LocalDate.of(2026, 10, 20), limiter.getState().getUtcDate());
        assertEquals(2, limiter.getState().getCount());
        assertEquals(2, limiter.getState().getTradesToday().size());
        assertEquals(2, ledger.getTrades().size());
    }

    @Test
    void execute_entry_shouldSizeFromQuoteBalanceAndKeepAdvisorLevels() {
        DecisionEngine engine = engine(new SimulatedExchange(properties, clock));

        ExecutionResult result = run(engine, "100", AdvisorAction.BUY);

        Order order = result.getOrder();
        assertEquals(0, new BigDecimal("10").compareTo(order.getQuantity()));
        assertEquals(0, new BigDecimal("95").compareTo(order.getStopLoss()));
        assertEquals(0, new BigDecimal("120").compareTo(order.getTakeProfit()));
        assertTrue(order.getClientOrderId().startsWith("pb-" + NOW.toEpochMilli()));
        assertNotNull(result.getTradeRecord());
        assertEquals(DecisionState.POSITION_OPEN, engine.getState());
    }

    @Test
    void execute_whenExchangeRejects_shouldLeaveCountAndPositionUnchanged() throws Exception {
        when(mockExchange.placeOrder(any(Order.class))).thenThrow(new OrderRejectedException("refused", "market closed"));
        DecisionEngine engine = engine(mockExchange);

        ExecutionResult result = run(engine, "100", AdvisorAction.STRONG_BUY);

        assertEquals(CycleOutcome.NOT_EXECUTED, result.getOutcome());
        assertEquals(DecisionReason.EXCHANGE_REJECTED, result.getReason());
        assertEquals(TradeDecision.HOLD, result.getAction());
        assertEquals(0, limiter.getState().getCount());
        assertFalse(ledger.hasOpenPosition());
        assertEquals(DecisionState.IDLE, engine.getState());
    }

    @Test
    void execute_whenRateLimited_shouldNotCountTrade() throws Exception {
        when(mockExchange.placeOrder(any(Order.class))).thenThrow(new RateLimitException("slow down", 1000));
        DecisionEngine engine = engine(mockExchange);

        ExecutionResult result = run(engine, "100", AdvisorAction.STRONG_BUY);

        assertEquals(DecisionReason.EXCHANGE_REJECTED, result.getReason());
        assertEquals(0, limiter.getState().getCount());
    }

    @Test
    void execute_whenLedgerRefusesFill_shouldStillCountTrade() throws Exception {
        when(mockExchange.placeOrder(any(Order.class))).thenReturn(
                new Fill("x-1", PRICE, new BigDecimal("1000"), BigDecimal.ZERO, NOW));
        DecisionEngine engine = engine(mockExchange);

        ExecutionResult result = run(engine, "100", AdvisorAction.STRONG_BUY);

        assertEquals(CycleOutcome.EXECUTED, result.getOutcome());
        assertNull(result.getTradeRecord());
        assertNotNull(result.getMessage());
        assertEquals(1, limiter.getState().getCount());
        assertFalse(ledger.hasOpenPosition());
    }

    @Test
    void execute_belowMinimumNotional_shouldHold() {
        ledger = new PortfolioLedger(properties, clock);
        ledger.seedBalances(Map.of("USDT", new BigDecimal("50")));
        DecisionEngine engine = engine(mockExchange);

        ExecutionResult result = run(engine, "100", AdvisorAction.STRONG_BUY);

        assertEquals(CycleOutcome.HOLD, result.getOutcome());
        assertEquals(DecisionReason.BELOW_MIN_NOTIONAL, result.getReason());
        verifyNoInteractions(mockExchange);
    }

    @Test
    void execute_afterDeadline_shouldAbandonWithoutSending() throws Exception {
        DecisionEngine engine = engine(mockExchange);

        ExecutionResult result = engine.execute(PRICE, neutralIndicators(), of(AdvisorAction.STRONG_BUY),
                NOW, NOW.minusSeconds(1));

        assertEquals(CycleOutcome.ABANDONED, result.getOutcome());
        verify(mockExchange, never()).placeOrder(any(Order.class));
        assertEquals(0, limiter.getState().getCount());
    }

    @Test
    void execute_whenStateCannotBePersisted_shouldBlockOrders() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "regular file");
        limiter = newLimiter(blocker.resolve("trade_state.json"));
        DecisionEngine engine = engine(mockExchange);

        ExecutionResult result = run(engine, "100", AdvisorAction.STRONG_BUY);

        assertEquals(TradeDecision.HOLD, result.getAction());
        assertEquals(DecisionReason.PERSISTENCE_FAILURE, result.getReason());
        verifyNoInteractions(mockExchange);
    }

    @Test
    void protectiveLevels_onWrongSideOfEntry_shouldFallBackToPercentages() {
        DecisionEngine engine = engine(mockExchange);
        AdvisorRecommendation wrongSide = of(AdvisorAction.BUY, RecommendationSource.AI, "105", "90");

        BigDecimal stopLoss = engine.protectiveStopLoss(PRICE, wrongSide.getStopLoss());
        BigDecimal takeProfit = engine.protectiveTakeProfit(PRICE, wrongSide.getTakeProfit());

        assertEquals(0, new BigDecimal("95").compareTo(stopLoss));
        assertEquals(0, new BigDecimal("110").compareTo(takeProfit));
    }
}
