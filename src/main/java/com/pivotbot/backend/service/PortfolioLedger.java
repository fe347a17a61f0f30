package com.pivotbot.backend.service;

import com.pivotbot.backend.config.TradingProperties;
import com.pivotbot.backend.model.Fill;
import com.pivotbot.backend.model.Order;
import com.pivotbot.backend.model.OrderSide;
import com.pivotbot.backend.model.PortfolioSnapshot;
import com.pivotbot.backend.model.Position;
import com.pivotbot.backend.model.ReconciliationReport;
import com.pivotbot.backend.model.TradeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory book of balances, the open position and realized P&L, fed by confirmed fills.
 */
@Service
public class PortfolioLedger {

    private static final Logger logger = LoggerFactory.getLogger(PortfolioLedger.class);

    private final String symbol;
    private final String baseAsset;
    private final String quoteAsset;
    private final BigDecimal tolerance;
    private final Clock clock;

    private final Map<String, BigDecimal> balances = new LinkedHashMap<>();
    private final List<TradeRecord> trades = new ArrayList<>();
    private Position position;
    private BigDecimal realizedPnl = BigDecimal.ZERO;
    private BigDecimal markPrice;
    private boolean seeded;

    @Autowired
    public PortfolioLedger(TradingProperties properties, Clock clock) {
        this.symbol = properties.getSymbol();
        this.baseAsset = properties.getBaseAsset();
        this.quoteAsset = properties.getQuoteAsset();
        this.tolerance = properties.getReconciliationTolerance();
        this.clock = clock;
        balances.put(quoteAsset, BigDecimal.ZERO);
        balances.put(baseAsset, BigDecimal.ZERO);
    }

    /**
     * Takes opening balances once, from the first balance report of the exchange.
     *
     * @return false if the ledger had already been seeded
     */
    public synchronized boolean seedBalances(Map<String, BigDecimal> openingBalances) {
        if (seeded) {
            return false;
        }
        for (Map.Entry<String, BigDecimal> entry : openingBalances.entrySet()) {
            if (entry.getValue().signum() < 0) {
                throw new IllegalArgumentException("Negative opening balance for " + entry.getKey());
            }
            balances.put(entry.getKey(), entry.getValue());
        }
        seeded = true;
        logger.info("Ledger seeded with opening balances {}", balances);
        if (balanceOf(baseAsset).signum() > 0) {
            logger.warn("Opening {} balance {} is not tracked as a position", baseAsset, balanceOf(baseAsset));
        }
        return true;
    }

    public synchronized boolean isSeeded() {
        return seeded;
    }

    /**
     * Books a confirmed fill. A buy opens the position with the order's stop-loss and take-profit;
     * a sell closes the whole position and realizes {@code (exit - entry) * quantity * sign(side)}.
     *
     * @return the appended trade record
     * @throws IllegalStateException if the fill would open a second position, close a missing one,
     *                               close only part of it, or drive a balance negative; nothing changes then
     */
    public synchronized TradeRecord applyFill(Order order, Fill fill) {
        if (!symbol.equals(order.getSymbol())) {
            throw new IllegalStateException("Fill for " + order.getSymbol() + " does not belong to ledger of " + symbol);
        }
        if (fill.getQuantity().signum() <= 0 || fill.getPrice().signum() <= 0) {
            throw new IllegalStateException("Fill " + fill + " has non-positive quantity or price");
        }
        TradeRecord record = order.getSide() == OrderSide.BUY ? applyBuy(order, fill) : applySell(order, fill);
        trades.add(record);
        markPrice = fill.getPrice();
        return record;
    }

    private TradeRecord applyBuy(Order order, Fill fill) {
        if (position != null) {
            throw new IllegalStateException("Position already open, refusing second entry " + order.getClientOrderId());
        }
        if (order.getStopLoss() == null || order.getTakeProfit() == null) {
            throw new IllegalStateException("Entry order " + order.getClientOrderId() + " has no stop-loss/take-profit");
        }
        BigDecimal cost = fill.getPrice().multiply(fill.getQuantity(), MathContext.DECIMAL64).add(fill.getFee());
        BigDecimal quote = balanceOf(quoteAsset);
        if (quote.compareTo(cost) < 0) {
            throw new IllegalStateException("Buy of " + cost + " " + quoteAsset + " exceeds ledger balance " + quote);
        }

        balances.put(quoteAsset, quote.subtract(cost));
        balances.put(baseAsset, balanceOf(baseAsset).add(fill.getQuantity()));
        position = new Position(symbol, OrderSide.BUY, fill.getPrice(), fill.getQuantity(),
                order.getStopLoss(), order.getTakeProfit(), fill.getTimestamp());
        logger.info("Opened position {}", position);
        return new TradeRecord(fill.getTimestamp(), symbol, OrderSide.BUY, fill.getPrice(), fill.getQuantity(),
                BigDecimal.ZERO, fill.getOrderId(), order.getReason());
    }

    private TradeRecord applySell(Order order, Fill fill) {
        if (position == null) {
            throw new IllegalStateException("No open position to close with " + order.getClientOrderId());
        }
        if (fill.getQuantity().compareTo(position.getQuantity()) != 0) {
            throw new IllegalStateException("Partial exit of " + fill.getQuantity() + " from position of " + position.getQuantity());
        }
        BigDecimal base = balanceOf(baseAsset);
        if (base.compareTo(fill.getQuantity()) < 0) {
            throw new IllegalStateException("Sell of " + fill.getQuantity() + " " + baseAsset + " exceeds ledger balance " + base);
        }
        BigDecimal proceeds = fill.getPrice().multiply(fill.getQuantity(), MathContext.DECIMAL64).subtract(fill.getFee());
        BigDecimal quote = balanceOf(quoteAsset).add(proceeds);
        if (quote.signum() < 0) {
            throw new IllegalStateException("Fee of sell " + order.getClientOrderId() + " exceeds quote balance");
        }

        BigDecimal pnl = fill.getPrice().subtract(position.getEntryPrice())
                .multiply(fill.getQuantity(), MathContext.DECIMAL64)
                .multiply(BigDecimal.valueOf(position.sign()));
        balances.put(baseAsset, base.subtract(fill.getQuantity()));
        balances.put(quoteAsset, quote);
        realizedPnl = realizedPnl.add(pnl);
        logger.info("Closed position {} at {} ({}), realized P&L {}", position, fill.getPrice(), order.getReason(), pnl);
        position = null;
        return new TradeRecord(fill.getTimestamp(), symbol, OrderSide.SELL, fill.getPrice(), fill.getQuantity(),
                pnl, fill.getOrderId(), order.getReason());
    }

    /**
     * Compares ledger balances with what the exchange reports. Drift beyond the tolerance is
     * logged and reported; the ledger itself is left as it is.
     */
    public synchronized ReconciliationReport reconcile(Map<String, BigDecimal> exchangeBalances) {
        Set<String> assets = new LinkedHashSet<>(balances.keySet());
        assets.addAll(exchangeBalances.keySet());

        List<ReconciliationReport.Discrepancy> discrepancies = new ArrayList<>();
        for (String asset : assets) {
            BigDecimal ledgerAmount = balanceOf(asset);
            BigDecimal exchangeAmount = exchangeBalances.getOrDefault(asset, BigDecimal.ZERO);
            if (exchangeAmount.subtract(ledgerAmount).abs().compareTo(tolerance) > 0) {
                logger.warn("Balance drift for {}: ledger {} vs exchange {}", asset, ledgerAmount, exchangeAmount);
                discrepancies.add(new ReconciliationReport.Discrepancy(asset, ledgerAmount, exchangeAmount));
            }
        }
        return ReconciliationReport.builder()
                .checkedAt(clock.instant())
                .tolerance(tolerance)
                .discrepancies(List.copyOf(discrepancies))
                .build();
    }

    public synchronized void markPrice(BigDecimal price) {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Mark price must be positive: " + price);
        }
        this.markPrice = price;
    }

    public synchronized PortfolioSnapshot snapshot() {
        int wins = 0;
        int losses = 0;
        int closed = 0;
        BigDecimal largestWin = BigDecimal.ZERO;
        BigDecimal largestLoss = BigDecimal.ZERO;
        for (TradeRecord trade : trades) {
            if (!trade.isClosing()) {
                continue;
            }
            closed++;
            BigDecimal pnl = trade.getRealizedPnl();
            if (pnl.signum() > 0) {
                wins++;
                largestWin = largestWin.max(pnl);
            } else if (pnl.signum() < 0) {
                losses++;
                largestLoss = largestLoss.min(pnl);
            }
        }
        BigDecimal winRate = closed == 0 ? BigDecimal.ZERO
                : BigDecimal.valueOf(wins * 100L).divide(BigDecimal.valueOf(closed), 2, RoundingMode.HALF_UP);

        BigDecimal unrealized = position != null && markPrice != null ? position.unrealizedPnl(markPrice) : BigDecimal.ZERO;
        BigDecimal baseValue = markPrice != null ? balanceOf(baseAsset).multiply(markPrice, MathContext.DECIMAL64) : BigDecimal.ZERO;

        return PortfolioSnapshot.builder()
                .balances(Map.copyOf(balances))
                .position(position)
                .realizedPnl(realizedPnl)
                .unrealizedPnl(unrealized)
                .markPrice(markPrice)
                .portfolioValue(balanceOf(quoteAsset).add(baseValue))
                .trades(List.copyOf(trades))
                .totalTrades(trades.size())
                .winningTrades(wins)
                .losingTrades(losses)
                .winRate(winRate)
                .largestWin(largestWin)
                .largestLoss(largestLoss)
                .takenAt(clock.instant())
                .build();
    }

    public synchronized Position getPosition() {
        return position;
    }

    public synchronized boolean hasOpenPosition() {
        return position != null;
    }

    public synchronized BigDecimal balanceOf(String asset) {
        return balances.getOrDefault(asset, BigDecimal.ZERO);
    }

    public synchronized List<TradeRecord> getTrades() {
        return List.copyOf(trades);
    }
}
