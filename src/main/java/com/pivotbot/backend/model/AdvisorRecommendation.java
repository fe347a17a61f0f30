package com.pivotbot.backend.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Advice produced for one cycle. Every price field is always populated; when the AI backend
 * does not deliver a field the deterministic value takes its place.
 */
@Value
public class AdvisorRecommendation {
    private static final BigDecimal MAX_CONFIDENCE = BigDecimal.valueOf(100);

    AdvisorAction action;
    BigDecimal confidence;
    BigDecimal stopLoss;
    BigDecimal takeProfit;
    BigDecimal buyTarget;
    BigDecimal sellTarget;
    String reasoning;
    RecommendationSource source;
    Instant createdAt;

    @Builder
    private AdvisorRecommendation(AdvisorAction action, BigDecimal confidence, BigDecimal stopLoss,
                                  BigDecimal takeProfit, BigDecimal buyTarget, BigDecimal sellTarget,
                                  String reasoning, RecommendationSource source, Instant createdAt) {
        this.action = Objects.requireNonNull(action, "action");
        this.confidence = clampConfidence(Objects.requireNonNull(confidence, "confidence"));
        this.stopLoss = Objects.requireNonNull(stopLoss, "stopLoss");
        this.takeProfit = Objects.requireNonNull(takeProfit, "takeProfit");
        this.buyTarget = Objects.requireNonNull(buyTarget, "buyTarget");
        this.sellTarget = Objects.requireNonNull(sellTarget, "sellTarget");
        this.reasoning = reasoning != null ? reasoning : "";
        this.source = Objects.requireNonNull(source, "source");
        // stamped by the producer from the injected clock
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public static BigDecimal clampConfidence(BigDecimal value) {
        if (value.signum() < 0) {
            return BigDecimal.ZERO;
        }
        return value.compareTo(MAX_CONFIDENCE) > 0 ? MAX_CONFIDENCE : value;
    }

    @Override
    public String toString() {
        return "AdvisorRecommendation{" + action + " @" + confidence + "% source=" + source
                + ", sl=" + stopLoss + ", tp=" + takeProfit
                + ", buy=" + buyTarget + ", sell=" + sellTarget + '}';
    }
}
