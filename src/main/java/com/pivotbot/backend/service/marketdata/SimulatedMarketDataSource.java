package com.pivotbot.backend.service.marketdata;

import com.pivotbot.backend.config.TradingProperties;
import com.pivotbot.backend.model.Candle;
import com.pivotbot.backend.model.MarketSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Random-walk market. Keeps 48 hourly candles; every snapshot moves the price by up to
 * +/- the configured volatility and updates the forming candle of the current hour.
 */
@Service
@ConditionalOnProperty(name = "trading.market-data-source", havingValue = "simulated", matchIfMissing = true)
public class SimulatedMarketDataSource implements MarketDataSource {

    private static final Logger logger = LoggerFactory.getLogger(SimulatedMarketDataSource.class);

    static final int HISTORY_HOURS = 48;
    private static final Duration HOUR = Duration.ofHours(1);
    private static final int PRICE_SCALE = 2;

    private final Clock clock;
    private final Random random;
    private final double volatility;
    private final List<Candle> candles = new ArrayList<>();
    private BigDecimal currentPrice;

    @Autowired
    public SimulatedMarketDataSource(TradingProperties properties, Clock clock) {
        this(clock,
                properties.getSimulation().getSeed() != null ? new Random(properties.getSimulation().getSeed()) : new Random(),
                properties.getSimulation().getVolatility(),
                properties.getSimulation().getInitialPrice());
    }

    SimulatedMarketDataSource(Clock clock, Random random, double volatility, BigDecimal initialPrice) {
        this.clock = clock;
        this.random = random;
        this.volatility = volatility;
        this.currentPrice = initialPrice;
        seedHistory(clock.instant());
        logger.info("Simulated market data seeded with {} hourly candles around {}", candles.size(), initialPrice);
    }

    @Override
    public String getSourceName() {
        return "SIMULATION";
    }

    @Override
    public synchronized MarketSnapshot snapshot(String symbol) {
        Instant now = clock.instant();
        currentPrice = step(currentPrice);
        rollForward(now);
        updateFormingCandle(currentPrice);
        return MarketSnapshot.fromHourlyCandles(symbol, candles, currentPrice, now);
    }

    private void seedHistory(Instant now) {
        Instant currentHour = now.truncatedTo(ChronoUnit.HOURS);
        BigDecimal price = currentPrice;
        for (int i = HISTORY_HOURS - 1; i >= 0; i--) {
            Instant open = currentHour.minus(HOUR.multipliedBy(i));
            BigDecimal close = i == 0 ? price : step(price);
            candles.add(syntheticCandle(open, price, close));
            price = close;
        }
        currentPrice = price;
    }

    private void rollForward(Instant now) {
        Instant currentHour = now.truncatedTo(ChronoUnit.HOURS);
        Candle last = candles.get(candles.size() - 1);
        Instant nextOpen = last.getOpenTime().plus(HOUR);
        while (!nextOpen.isAfter(currentHour)) {
            BigDecimal open = candles.get(candles.size() - 1).getClose();
            candles.add(syntheticCandle(nextOpen, open, open));
            nextOpen = nextOpen.plus(HOUR);
        }
        while (candles.size() > HISTORY_HOURS) {
            candles.remove(0);
        }
    }

    private void updateFormingCandle(BigDecimal price) {
        int lastIndex = candles.size() - 1;
        Candle forming = candles.get(lastIndex);
        candles.set(lastIndex, new Candle(forming.getOpenTime(), forming.getCloseTime(), forming.getOpen(),
                forming.getHigh().max(price), forming.getLow().min(price), price, forming.getVolume()));
    }

    private Candle syntheticCandle(Instant open, BigDecimal openPrice, BigDecimal closePrice) {
        BigDecimal high = openPrice.max(closePrice).multiply(BigDecimal.valueOf(1 + random.nextDouble() * volatility / 2), MathContext.DECIMAL64);
        BigDecimal low = openPrice.min(closePrice).multiply(BigDecimal.valueOf(1 - random.nextDouble() * volatility / 2), MathContext.DECIMAL64);
        BigDecimal volume = BigDecimal.valueOf(100 + random.nextDouble() * 900).setScale(4, RoundingMode.HALF_UP);
        return new Candle(open, open.plus(HOUR), openPrice,
                high.setScale(PRICE_SCALE, RoundingMode.HALF_UP),
                low.setScale(PRICE_SCALE, RoundingMode.HALF_UP),
                closePrice, volume);
    }

    private BigDecimal step(BigDecimal price) {
        double changePercent = (random.nextDouble() * 2 - 1) * volatility;
        BigDecimal next = price.multiply(BigDecimal.valueOf(1 + changePercent), MathContext.DECIMAL64)
                .setScale(PRICE_SCALE, RoundingMode.HALF_UP);
        // a walk never goes to zero
        return next.signum() > 0 ? next : price;
    }
}
