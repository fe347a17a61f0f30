package com.pivotbot.backend.service.ai;

import com.pivotbot.backend.config.TradingProperties;
import com.pivotbot.backend.model.Candle;
import com.pivotbot.backend.model.IndicatorSet;
import com.pivotbot.backend.model.MarketSnapshot;
import com.pivotbot.backend.model.PivotLevels;
import com.pivotbot.backend.model.PortfolioSnapshot;
import com.pivotbot.backend.model.Position;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Builds the labeled-answer prompt sent to the AI backend.
 */
@Component
public class AdvisorPromptBuilder {

    private static final DateTimeFormatter HOUR_FORMAT = DateTimeFormatter.ofPattern("MM-dd HH:mm").withZone(ZoneOffset.UTC);
    private static final int HOURLY_LINES = 12;

    private final TradingProperties properties;

    @Autowired
    public AdvisorPromptBuilder(TradingProperties properties) {
        this.properties = properties;
    }

    public String build(MarketSnapshot snapshot, IndicatorSet indicators, PivotLevels pivots, PortfolioSnapshot portfolio) {
        BigDecimal price = snapshot.getCurrentPrice();
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are a crypto trading analyst specializing in support and resistance analysis. ")
              .append("Analyze the following market data and calculate precise support/resistance levels.\n\n");

        prompt.append("MARKET DATA FOR ").append(snapshot.getSymbol()).append(":\n");
        prompt.append("- Current Price: $").append(money(price)).append('\n');
        prompt.append("- 24h High: $").append(money(snapshot.getHigh24h())).append('\n');
        prompt.append("- 24h Low: $").append(money(snapshot.getLow24h())).append('\n');
        prompt.append("- 24h Change: ").append(money(snapshot.getPriceChange24hPercent())).append("%\n");
        prompt.append("- Price Ranges: 12h Range: $").append(money(snapshot.getLow12h()))
              .append(" - $").append(money(snapshot.getHigh12h()))
              .append(", 48h Range: $").append(money(snapshot.getLow48h()))
              .append(" - $").append(money(snapshot.getHigh48h())).append('\n');
        prompt.append("- Moving Averages: SMA(").append(properties.getSmaShortPeriod()).append("): ")
              .append(money(indicators.getSmaShort()))
              .append(", SMA(").append(properties.getSmaLongPeriod()).append("): ")
              .append(money(indicators.getSmaLong()))
              .append(", Trend: ").append(indicators.isBullishTrend() ? "BULLISH (short > long)" : "BEARISH (short < long)")
              .append('\n');
        prompt.append("- RSI (").append(properties.getRsiPeriod()).append("): ")
              .append(money(indicators.getRsi())).append(" (").append(rsiCondition(indicators.getRsi())).append(")\n");
        prompt.append("- Account Balance: $").append(money(portfolio.balanceOf(properties.getQuoteAsset())))
              .append(' ').append(properties.getQuoteAsset()).append("\n\n");

        prompt.append("HOURLY PRICE DATA (UTC, open/high/low/close):\n");
        List<Candle> hourly = snapshot.getCandles24h();
        for (Candle candle : hourly.subList(Math.max(0, hourly.size() - HOURLY_LINES), hourly.size())) {
            prompt.append("- ").append(HOUR_FORMAT.format(candle.getOpenTime())).append(": ")
                  .append(money(candle.getOpen())).append(" / ").append(money(candle.getHigh())).append(" / ")
                  .append(money(candle.getLow())).append(" / ").append(money(candle.getClose())).append('\n');
        }

        prompt.append("\nREFERENCE PIVOT LEVELS (prior closed 24h):\n");
        prompt.append("- PP: $").append(money(pivots.getPivot()))
              .append(", S1: $").append(money(pivots.getSupport1()))
              .append(", S2: $").append(money(pivots.getSupport2()))
              .append(", R1: $").append(money(pivots.getResistance1()))
              .append(", R2: $").append(money(pivots.getResistance2())).append("\n\n");

        prompt.append("CURRENT POSITION:\n").append(positionInfo(portfolio.getPosition(), price)).append("\n\n");

        prompt.append("Calculate support and resistance levels using:\n")
              .append("1. Pivot Point method: PP = (High + Low + Close) / 3\n")
              .append("2. Support 1: S1 = 2*PP - High\n")
              .append("3. Support 2: S2 = PP - (High - Low)\n")
              .append("4. Resistance 1: R1 = 2*PP - Low\n")
              .append("5. Resistance 2: R2 = PP + (High - Low)\n\n");

        prompt.append("Provide your analysis in EXACTLY this format (use these exact labels):\n\n")
              .append("RECOMMENDATION: [STRONG_BUY/BUY/HOLD/SELL/STRONG_SELL]\n")
              .append("CONFIDENCE: [0-100]%\n")
              .append("STOP_LOSS: $[price]\n")
              .append("TAKE_PROFIT: $[price]\n")
              .append("BUY_TARGET: $[price - a good entry point near support]\n")
              .append("SELL_TARGET: $[price - a good exit point near resistance]\n")
              .append("SUPPORT: $[S1 price]\n")
              .append("STRONG_SUPPORT: $[S2 price]\n")
              .append("RESISTANCE: $[R1 price]\n")
              .append("STRONG_RESISTANCE: $[R2 price]\n")
              .append("PIVOT: $[pivot point price]\n")
              .append("REASONING: [Your 2-3 sentence explanation including support/resistance analysis]\n\n");

        prompt.append("Rules:\n")
              .append("1. BUY_TARGET should be near a support level for good entry\n")
              .append("2. SELL_TARGET should be near a resistance level for good exit\n")
              .append("3. Stop-loss must be below the current price, take-profit above it\n")
              .append("4. Even for HOLD recommendations, provide buy/sell targets for future reference\n")
              .append("5. Provide specific dollar amounts, not percentages");
        return prompt.toString();
    }

    private String positionInfo(Position position, BigDecimal price) {
        if (position == null) {
            return "No open position";
        }
        BigDecimal pnlPercent = price.subtract(position.getEntryPrice())
                .divide(position.getEntryPrice(), MathContext.DECIMAL64)
                .multiply(BigDecimal.valueOf(100));
        return "Entry: $" + money(position.getEntryPrice()) + ", Quantity: " + position.getQuantity().stripTrailingZeros().toPlainString()
                + ", Current P&L: " + money(pnlPercent) + "%";
    }

    private String rsiCondition(BigDecimal rsi) {
        if (rsi.compareTo(properties.getRsiOverbought()) > 0) {
            return "OVERBOUGHT";
        }
        if (rsi.compareTo(properties.getRsiOversold()) < 0) {
            return "OVERSOLD";
        }
        return "NEUTRAL";
    }

    private static String money(BigDecimal value) {
        return value == null ? "n/a" : value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
