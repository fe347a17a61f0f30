package com.pivotbot.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Trading settings bound from the {@code trading.*} keys.
 */
@Data
@ConfigurationProperties(prefix = "trading")
public class TradingProperties {

    private String symbol = "BTCUSDT";
    private String baseAsset = "BTC";
    private String quoteAsset = "USDT";

    private int maxTradesPerDay = 2;
    /** Share of the available quote balance spent on an entry. */
    private BigDecimal positionFraction = new BigDecimal("0.10");
    private BigDecimal minNotional = new BigDecimal("10");
    private BigDecimal stopLossPercent = new BigDecimal("-5");
    private BigDecimal takeProfitPercent = new BigDecimal("10");

    private int smaShortPeriod = 10;
    private int smaLongPeriod = 20;
    private int rsiPeriod = 14;
    private BigDecimal rsiOversold = new BigDecimal("30");
    private BigDecimal rsiOverbought = new BigDecimal("70");

    private long cycleIntervalMs = 30_000;
    private long cycleDeadlineMs = 150_000;
    private long balanceTimeoutMs = 5_000;

    private String stateFile = "data/trade_state.json";
    private String reportFile = "data/status_report.json";
    private BigDecimal reconciliationTolerance = new BigDecimal("0.00000001");

    /** {@code simulated} or {@code binance}. */
    private String marketDataSource = "simulated";

    private Simulation simulation = new Simulation();

    @Data
    public static class Simulation {
        private BigDecimal initialBalance = new BigDecimal("10000");
        private BigDecimal initialPrice = new BigDecimal("50000");
        private double volatility = 0.02;
        private Long seed;
    }
}
