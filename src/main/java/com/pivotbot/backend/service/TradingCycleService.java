package com.pivotbot.backend.service;

import com.pivotbot.backend.config.AppConfig;
import com.pivotbot.backend.config.TradingProperties;
import com.pivotbot.backend.exception.ExchangeException;
import com.pivotbot.backend.exception.InsufficientDataException;
import com.pivotbot.backend.exception.MarketDataException;
import com.pivotbot.backend.model.AdvisorRecommendation;
import com.pivotbot.backend.model.CycleOutcome;
import com.pivotbot.backend.model.CycleReport;
import com.pivotbot.backend.model.DecisionReason;
import com.pivotbot.backend.model.ExecutionResult;
import com.pivotbot.backend.model.IndicatorSet;
import com.pivotbot.backend.model.MarketSnapshot;
import com.pivotbot.backend.model.PivotLevels;
import com.pivotbot.backend.model.PortfolioSnapshot;
import com.pivotbot.backend.model.ReconciliationReport;
import com.pivotbot.backend.model.TradeDecision;
import com.pivotbot.backend.service.ai.AdvisorBridge;
import com.pivotbot.backend.service.exchange.Exchange;
import com.pivotbot.backend.service.marketdata.MarketDataSource;
import com.pivotbot.backend.service.report.ReportRenderer;
import com.pivotbot.backend.service.util.IndicatorEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives one trading cycle per interval: market snapshot, indicators, advisor and balance fetch in
 * parallel, decision, report. Only one cycle runs at a time and a cycle that overruns its deadline
 * is dropped before it mutates anything.
 */
@Service
public class TradingCycleService {

    private static final Logger logger = LoggerFactory.getLogger(TradingCycleService.class);

    private final MarketDataSource marketDataSource;
    private final AdvisorBridge advisorBridge;
    private final Exchange exchange;
    private final DecisionEngine decisionEngine;
    private final PortfolioLedger ledger;
    private final TradeLimiter tradeLimiter;
    private final PriceTargetMonitor priceTargetMonitor;
    private final ReportRenderer reportRenderer;
    private final ExecutorService cycleIoExecutor;
    private final TradingProperties properties;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private volatile CycleReport lastReport;

    @Autowired
    public TradingCycleService(MarketDataSource marketDataSource,
                               AdvisorBridge advisorBridge,
                               Exchange exchange,
                               DecisionEngine decisionEngine,
                               PortfolioLedger ledger,
                               TradeLimiter tradeLimiter,
                               PriceTargetMonitor priceTargetMonitor,
                               ReportRenderer reportRenderer,
                               @Qualifier(AppConfig.CYCLE_IO_EXECUTOR) ExecutorService cycleIoExecutor,
                               TradingProperties properties,
                               Clock clock) {
        this.marketDataSource = marketDataSource;
        this.advisorBridge = advisorBridge;
        this.exchange = exchange;
        this.decisionEngine = decisionEngine;
        this.ledger = ledger;
        this.tradeLimiter = tradeLimiter;
        this.priceTargetMonitor = priceTargetMonitor;
        this.reportRenderer = reportRenderer;
        this.cycleIoExecutor = cycleIoExecutor;
        this.properties = properties;
        this.clock = clock;
        logger.info("Trading {} on {} with {} market data, max {} trades/day, cycle every {}ms",
                properties.getSymbol(), exchange.getExchangeName(), marketDataSource.getSourceName(),
                properties.getMaxTradesPerDay(), properties.getCycleIntervalMs());
    }

    @Scheduled(fixedDelayString = "${trading.cycle-interval-ms:30000}", initialDelayString = "${trading.initial-delay-ms:5000}")
    public void scheduledCycle() {
        runCycle();
    }

    /**
     * Runs a cycle unless one is already in progress.
     *
     * @return the cycle report, or empty if another cycle holds the lock
     */
    public Optional<CycleReport> runCycle() {
        if (!cycleLock.tryLock()) {
            logger.warn("Previous trading cycle still running, skipping this trigger");
            return Optional.empty();
        }
        try {
            CycleReport report = doCycle();
            lastReport = report;
            reportRenderer.render(report);
            return Optional.of(report);
        } finally {
            cycleLock.unlock();
        }
    }

    public CycleReport getLastReport() {
        return lastReport;
    }

    public boolean isCycleRunning() {
        return cycleLock.isLocked();
    }

    private CycleReport doCycle() {
        Instant start = clock.instant();
        Instant deadline = start.plusMillis(properties.getCycleDeadlineMs());
        String symbol = properties.getSymbol();

        MarketSnapshot snapshot;
        try {
            snapshot = marketDataSource.snapshot(symbol);
        } catch (MarketDataException e) {
            logger.warn("Market data for {} unavailable, skipping cycle: {}", symbol, e.getMessage());
            return skipped(start, null, null, null, null, "Market data unavailable: " + e.getMessage());
        }
        BigDecimal price = snapshot.getCurrentPrice();

        IndicatorSet indicators;
        PivotLevels pivots;
        try {
            indicators = IndicatorEngine.computeIndicators(snapshot.getCandles24h(),
                    properties.getSmaShortPeriod(), properties.getSmaLongPeriod(), properties.getRsiPeriod());
            pivots = IndicatorEngine.computePivotLevels(snapshot.getCandles24h(), snapshot.getCapturedAt());
        } catch (InsufficientDataException e) {
            logger.warn("Not enough candles for {}, skipping cycle: {}", symbol, e.getMessage());
            return skipped(start, price, null, null, null, e.getMessage());
        }
        logger.debug("{} price {} {} {}", symbol, price, indicators, pivots);

        PortfolioSnapshot portfolio = ledger.snapshot();
        CompletableFuture<AdvisorRecommendation> adviceFuture = CompletableFuture.supplyAsync(
                () -> advisorBridge.getRecommendation(snapshot, indicators, pivots, portfolio), cycleIoExecutor);
        CompletableFuture<Map<String, BigDecimal>> balancesFuture = CompletableFuture.supplyAsync(
                this::fetchBalances, cycleIoExecutor);

        AdvisorRecommendation recommendation;
        try {
            recommendation = adviceFuture.get(remainingMillis(deadline), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            adviceFuture.cancel(true);
            balancesFuture.cancel(true);
            return abandoned(start, price, indicators, pivots, "Advisor did not finish before the cycle deadline");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            balancesFuture.cancel(true);
            return abandoned(start, price, indicators, pivots, "Interrupted while waiting for the advisor");
        } catch (ExecutionException e) {
            // AdvisorBridge never throws; anything here is a bug worth surfacing
            throw new IllegalStateException("Advisor task failed", e.getCause());
        }

        Map<String, BigDecimal> exchangeBalances = awaitBalances(balancesFuture);

        if (clock.instant().isAfter(deadline)) {
            return abandoned(start, price, indicators, pivots, "Cycle deadline passed before decision");
        }

        ReconciliationReport reconciliation = null;
        if (exchangeBalances != null) {
            ledger.seedBalances(exchangeBalances);
            reconciliation = ledger.reconcile(exchangeBalances);
        } else if (!ledger.isSeeded()) {
            return skipped(start, price, indicators, pivots, recommendation, "Opening balances not yet available");
        }

        ledger.markPrice(price);
        priceTargetMonitor.check(price, ledger.getPosition(), recommendation, clock.instant());
        ExecutionResult result = decisionEngine.execute(price, indicators, recommendation, clock.instant(), deadline);
        if (result.isExecuted()) {
            advisorBridge.invalidate(symbol);
        }

        logger.info("Cycle {}: price {}, advisor {} ({}), decision {} ({}), outcome {}", symbol, price,
                recommendation.getAction(), recommendation.getSource(), result.getAction(), result.getReason(), result.getOutcome());

        return CycleReport.builder()
                .timestamp(start)
                .symbol(symbol)
                .currentPrice(price)
                .outcome(result.getOutcome())
                .stateBefore(result.getStateBefore())
                .stateAfter(result.getStateAfter())
                .action(result.getAction())
                .reason(result.getReason())
                .indicators(indicators)
                .pivotLevels(pivots)
                .recommendation(recommendation)
                .portfolio(ledger.snapshot())
                .limiter(tradeLimiter.status(clock.instant()))
                .reconciliation(reconciliation)
                .alerts(priceTargetMonitor.getRecentAlerts())
                .message(result.getMessage())
                .build();
    }

    private Map<String, BigDecimal> fetchBalances() {
        try {
            return exchange.getBalances();
        } catch (ExchangeException e) {
            throw new CompletionException(e);
        }
    }

    private Map<String, BigDecimal> awaitBalances(CompletableFuture<Map<String, BigDecimal>> balancesFuture) {
        try {
            return balancesFuture.get(properties.getBalanceTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            balancesFuture.cancel(true);
            logger.warn("Balance fetch from {} timed out, skipping reconciliation", exchange.getExchangeName());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while fetching balances");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof CompletionException && e.getCause().getCause() != null
                    ? e.getCause().getCause() : e.getCause();
            logger.warn("Balance fetch from {} failed, skipping reconciliation: {}",
                    exchange.getExchangeName(), cause != null ? cause.getMessage() : e.getMessage());
        }
        return null;
    }

    private long remainingMillis(Instant deadline) {
        return Math.max(0, Duration.between(clock.instant(), deadline).toMillis());
    }

    private CycleReport skipped(Instant start, BigDecimal price, IndicatorSet indicators, PivotLevels pivots,
                                AdvisorRecommendation recommendation, String message) {
        return noOrder(start, price, indicators, pivots, recommendation, CycleOutcome.SKIPPED, message);
    }

    private CycleReport abandoned(Instant start, BigDecimal price, IndicatorSet indicators, PivotLevels pivots, String message) {
        logger.warn("Cycle abandoned: {}", message);
        return noOrder(start, price, indicators, pivots, null, CycleOutcome.ABANDONED, message);
    }

    private CycleReport noOrder(Instant start, BigDecimal price, IndicatorSet indicators, PivotLevels pivots,
                                AdvisorRecommendation recommendation, CycleOutcome outcome, String message) {
        return CycleReport.builder()
                .timestamp(start)
                .symbol(properties.getSymbol())
                .currentPrice(price)
                .outcome(outcome)
                .stateBefore(decisionEngine.getState())
                .stateAfter(decisionEngine.getState())
                .action(TradeDecision.HOLD)
                .reason(DecisionReason.NO_SIGNAL)
                .indicators(indicators)
                .pivotLevels(pivots)
                .recommendation(recommendation)
                .portfolio(ledger.snapshot())
                .limiter(tradeLimiter.status(clock.instant()))
                .alerts(priceTargetMonitor.getRecentAlerts())
                .message(message)
                .build();
    }
}
