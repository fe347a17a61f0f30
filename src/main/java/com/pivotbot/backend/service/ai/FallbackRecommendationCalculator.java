package com.pivotbot.backend.service.ai;

import com.pivotbot.backend.config.TradingProperties;
import com.pivotbot.backend.model.AdvisorAction;
import com.pivotbot.backend.model.AdvisorRecommendation;
import com.pivotbot.backend.model.IndicatorSet;
import com.pivotbot.backend.model.PivotLevels;
import com.pivotbot.backend.model.RecommendationSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Rule-based recommendation used whenever the AI backend cannot answer.
 * Targets come straight from the pivot levels; the action is an indicator score in [-2, 2].
 */
@Component
public class FallbackRecommendationCalculator {

    static final BigDecimal FALLBACK_CONFIDENCE = BigDecimal.valueOf(50);

    private final BigDecimal rsiOversold;
    private final BigDecimal rsiOverbought;
    private final Clock clock;

    @Autowired
    public FallbackRecommendationCalculator(TradingProperties properties, Clock clock) {
        this.rsiOversold = properties.getRsiOversold();
        this.rsiOverbought = properties.getRsiOverbought();
        this.clock = clock;
    }

    public AdvisorRecommendation calculate(IndicatorSet indicators, PivotLevels pivots) {
        int score = 0;
        List<String> signals = new ArrayList<>();

        if (indicators.getRsi().compareTo(rsiOversold) < 0) {
            score++;
            signals.add("RSI oversold");
        } else if (indicators.getRsi().compareTo(rsiOverbought) > 0) {
            score--;
            signals.add("RSI overbought");
        }

        if (indicators.isSmaCrossedUp()) {
            score++;
            signals.add("SMA crossed up");
        } else if (indicators.isSmaCrossedDown()) {
            score--;
            signals.add("SMA crossed down");
        }

        AdvisorAction action = AdvisorAction.fromScore(score);
        String reasoning = signals.isEmpty()
                ? "Rule-based HOLD: no indicator signal, targets at pivot support/resistance"
                : "Rule-based " + action + ": " + String.join(", ", signals);

        return AdvisorRecommendation.builder()
                .action(action)
                .confidence(FALLBACK_CONFIDENCE)
                .buyTarget(pivots.getSupport1())
                .sellTarget(pivots.getResistance1())
                .stopLoss(pivots.getSupport2())
                .takeProfit(pivots.getResistance2())
                .reasoning(reasoning)
                .source(RecommendationSource.FALLBACK)
                .createdAt(clock.instant())
                .build();
    }
}
