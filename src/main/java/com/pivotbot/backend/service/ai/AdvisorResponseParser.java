package com.pivotbot.backend.service.ai;

import com.pivotbot.backend.model.AdvisorAction;
import com.pivotbot.backend.model.AdvisorRecommendation;
import com.pivotbot.backend.model.RecommendationSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the labeled answer of the AI backend field by field. Fields that are missing or fail the
 * plausibility check take the value of the rule-based recommendation.
 */
@Component
public class AdvisorResponseParser {

    private static final Logger logger = LoggerFactory.getLogger(AdvisorResponseParser.class);

    private static final Pattern NUMBER = Pattern.compile("-?[0-9][0-9,]*(?:\\.[0-9]+)?");

    private final BigDecimal stopLossBand;
    private final BigDecimal levelBand;

    public AdvisorResponseParser(@Value("${advisor.stop-loss-band:0.20}") BigDecimal stopLossBand,
                                 @Value("${advisor.level-band:0.30}") BigDecimal levelBand) {
        this.stopLossBand = stopLossBand;
        this.levelBand = levelBand;
    }

    /**
     * @param response     raw text produced by the backend
     * @param currentPrice price the levels are checked against
     * @param fallback     rule-based recommendation supplying missing fields
     * @return the AI recommendation, or empty when the response carries no usable RECOMMENDATION
     */
    public Optional<AdvisorRecommendation> parse(String response, BigDecimal currentPrice, AdvisorRecommendation fallback) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        Optional<AdvisorAction> action = extractField(response, "RECOMMENDATION").flatMap(this::parseAction);
        if (action.isEmpty()) {
            logger.debug("AI response has no usable RECOMMENDATION field");
            return Optional.empty();
        }

        List<String> substituted = new ArrayList<>();

        BigDecimal confidence = extractNumber(response, "CONFIDENCE")
                .map(AdvisorRecommendation::clampConfidence)
                .orElse(null);
        if (confidence == null) {
            substituted.add("CONFIDENCE");
            confidence = fallback.getConfidence();
        }

        BigDecimal stopLoss = extractNumber(response, "STOP_LOSS")
                .filter(level -> level.compareTo(currentPrice) < 0 && withinBand(level, currentPrice, stopLossBand))
                .orElse(null);
        if (stopLoss == null) {
            substituted.add("STOP_LOSS");
            stopLoss = fallback.getStopLoss();
        }

        BigDecimal takeProfit = extractNumber(response, "TAKE_PROFIT")
                .filter(level -> level.compareTo(currentPrice) > 0 && withinBand(level, currentPrice, levelBand))
                .orElse(null);
        if (takeProfit == null) {
            substituted.add("TAKE_PROFIT");
            takeProfit = fallback.getTakeProfit();
        }

        BigDecimal buyTarget = extractNumber(response, "BUY_TARGET")
                .filter(level -> withinBand(level, currentPrice, levelBand))
                .orElse(null);
        if (buyTarget == null) {
            substituted.add("BUY_TARGET");
            buyTarget = fallback.getBuyTarget();
        }

        BigDecimal sellTarget = extractNumber(response, "SELL_TARGET")
                .filter(level -> withinBand(level, currentPrice, levelBand))
                .orElse(null);
        if (sellTarget == null) {
            substituted.add("SELL_TARGET");
            sellTarget = fallback.getSellTarget();
        }

        String reasoning = extractField(response, "REASONING").orElse("AI analysis completed");

        if (!substituted.isEmpty()) {
            logger.debug("AI response fields replaced by rule-based values: {}", substituted);
        }

        return Optional.of(AdvisorRecommendation.builder()
                .action(action.get())
                .confidence(confidence)
                .stopLoss(stopLoss)
                .takeProfit(takeProfit)
                .buyTarget(buyTarget)
                .sellTarget(sellTarget)
                .reasoning(reasoning)
                .source(RecommendationSource.AI)
                .createdAt(fallback.getCreatedAt())
                .build());
    }

    Optional<AdvisorAction> parseAction(String value) {
        String normalized = value.toUpperCase(Locale.ROOT)
                .replaceAll("[\\[\\]*`\"]", "")
                .trim()
                .replaceAll("[\\s-]+", "_");
        // longest names first so STRONG_BUY is not read as BUY
        for (AdvisorAction candidate : new AdvisorAction[]{AdvisorAction.STRONG_BUY, AdvisorAction.STRONG_SELL,
                AdvisorAction.BUY, AdvisorAction.SELL, AdvisorAction.HOLD}) {
            if (normalized.startsWith(candidate.name())) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Value after {@code LABEL:} on a line of its own; markdown bold and list markers are tolerated.
     */
    Optional<String> extractField(String response, String label) {
        Pattern pattern = Pattern.compile("(?im)^[\\s*#>-]*" + label.replace("_", "[_ ]") + "\\**\\s*[:=]\\**\\s*(.+)$");
        Matcher matcher = pattern.matcher(response);
        if (matcher.find()) {
            String value = matcher.group(1).trim();
            return value.isEmpty() ? Optional.empty() : Optional.of(value);
        }
        return Optional.empty();
    }

    Optional<BigDecimal> extractNumber(String response, String label) {
        Optional<String> field = extractField(response, label);
        if (field.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = NUMBER.matcher(field.get());
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(matcher.group().replace(",", "")));
        } catch (NumberFormatException e) {
            logger.debug("Could not parse {} value '{}'", label, field.get());
            return Optional.empty();
        }
    }

    private static boolean withinBand(BigDecimal level, BigDecimal currentPrice, BigDecimal band) {
        if (level.signum() <= 0) {
            return false;
        }
        BigDecimal maxDeviation = currentPrice.multiply(band);
        return level.subtract(currentPrice).abs().compareTo(maxDeviation) <= 0;
    }
}
