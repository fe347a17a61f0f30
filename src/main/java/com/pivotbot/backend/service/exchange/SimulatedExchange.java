package com.pivotbot.backend.service.exchange;

import com.pivotbot.backend.config.TradingProperties;
import com.pivotbot.backend.exception.ExchangeException;
import com.pivotbot.backend.exception.InsufficientBalanceException;
import com.pivotbot.backend.exception.OrderRejectedException;
import com.pivotbot.backend.model.Fill;
import com.pivotbot.backend.model.Order;
import com.pivotbot.backend.model.OrderSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Paper-trading venue holding a quote and a base balance in memory. Orders fill in full at the
 * price they were decided at.
 */
@Service
public class SimulatedExchange implements Exchange {

    private static final Logger logger = LoggerFactory.getLogger(SimulatedExchange.class);

    private final String symbol;
    private final String baseAsset;
    private final String quoteAsset;
    private final Clock clock;
    private final Map<String, BigDecimal> balances = new HashMap<>();
    private final AtomicLong orderIdCounter = new AtomicLong();

    @Autowired
    public SimulatedExchange(TradingProperties properties, Clock clock) {
        this.symbol = properties.getSymbol();
        this.baseAsset = properties.getBaseAsset();
        this.quoteAsset = properties.getQuoteAsset();
        this.clock = clock;
        balances.put(quoteAsset, properties.getSimulation().getInitialBalance());
        balances.put(baseAsset, BigDecimal.ZERO);
        logger.info("Simulation exchange initialized with {} {}", properties.getSimulation().getInitialBalance(), quoteAsset);
    }

    @Override
    public String getExchangeName() {
        return "SIMULATION";
    }

    @Override
    public synchronized Fill placeOrder(Order order) throws ExchangeException {
        if (!symbol.equals(order.getSymbol())) {
            throw new OrderRejectedException("Order " + order.getClientOrderId() + " refused", "unknown symbol " + order.getSymbol());
        }
        BigDecimal price = order.getReferencePrice();
        if (price.signum() <= 0) {
            throw new OrderRejectedException("Order " + order.getClientOrderId() + " refused", "non-positive price " + price);
        }
        BigDecimal quantity = order.getQuantity();
        BigDecimal notional = quantity.multiply(price, MathContext.DECIMAL64);

        if (order.getSide() == OrderSide.BUY) {
            BigDecimal available = balanceOf(quoteAsset);
            if (available.compareTo(notional) < 0) {
                throw new InsufficientBalanceException(quoteAsset, notional, available);
            }
            balances.put(quoteAsset, available.subtract(notional));
            balances.put(baseAsset, balanceOf(baseAsset).add(quantity));
        } else {
            BigDecimal available = balanceOf(baseAsset);
            if (available.compareTo(quantity) < 0) {
                throw new InsufficientBalanceException(baseAsset, quantity, available);
            }
            balances.put(baseAsset, available.subtract(quantity));
            balances.put(quoteAsset, balanceOf(quoteAsset).add(notional));
        }

        String orderId = "sim_" + orderIdCounter.incrementAndGet();
        logger.info("Simulated {} {} {} @ {} filled as {}", order.getSide(), quantity, order.getSymbol(), price, orderId);
        return new Fill(orderId, price, quantity, BigDecimal.ZERO, clock.instant());
    }

    @Override
    public synchronized Map<String, BigDecimal> getBalances() {
        return new LinkedHashMap<>(balances);
    }

    private BigDecimal balanceOf(String asset) {
        return balances.getOrDefault(asset, BigDecimal.ZERO);
    }
}
