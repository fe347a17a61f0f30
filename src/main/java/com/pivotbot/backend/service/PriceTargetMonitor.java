package com.pivotbot.backend.service;

import com.pivotbot.backend.model.AdvisorRecommendation;
import com.pivotbot.backend.model.PriceAlert;
import com.pivotbot.backend.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Watches the current price against the open position's protective levels and the advisor's
 * buy and sell targets. An alert is raised when a target becomes hit; a target that stays hit on
 * the following cycles is not reported again.
 */
@Service
public class PriceTargetMonitor {

    private static final Logger logger = LoggerFactory.getLogger(PriceTargetMonitor.class);

    static final int MAX_RECENT_ALERTS = 5;

    private final Deque<PriceAlert> recentAlerts = new ArrayDeque<>();
    private PriceAlert.Type lastHit;

    /**
     * Checks targets in priority order: stop-loss, take-profit, buy target, sell target.
     *
     * @param position open position, or null
     * @param recommendation this cycle's advice, or null when there is none
     * @return the alert raised by this check, if any
     */
    public synchronized Optional<PriceAlert> check(BigDecimal price, Position position,
                                                   AdvisorRecommendation recommendation, Instant now) {
        PriceAlert hit = firstHit(price, position, recommendation, now);
        PriceAlert.Type hitType = hit != null ? hit.getType() : null;
        if (hit == null || hitType == lastHit) {
            lastHit = hitType;
            return Optional.empty();
        }
        lastHit = hitType;
        recentAlerts.addFirst(hit);
        while (recentAlerts.size() > MAX_RECENT_ALERTS) {
            recentAlerts.removeLast();
        }
        logger.info("Price alert: {}", hit.getMessage());
        return Optional.of(hit);
    }

    /** Newest first. */
    public synchronized List<PriceAlert> getRecentAlerts() {
        return new ArrayList<>(recentAlerts);
    }

    private static PriceAlert firstHit(BigDecimal price, Position position,
                                       AdvisorRecommendation recommendation, Instant now) {
        if (position != null) {
            if (price.compareTo(position.getStopLoss()) <= 0) {
                return alert(PriceAlert.Type.STOP_LOSS, price, position.getStopLoss(), now);
            }
            if (price.compareTo(position.getTakeProfit()) >= 0) {
                return alert(PriceAlert.Type.TAKE_PROFIT, price, position.getTakeProfit(), now);
            }
        }
        if (recommendation == null) {
            return null;
        }
        if (price.compareTo(recommendation.getBuyTarget()) <= 0) {
            return alert(PriceAlert.Type.BUY_TARGET, price, recommendation.getBuyTarget(), now);
        }
        if (price.compareTo(recommendation.getSellTarget()) >= 0) {
            return alert(PriceAlert.Type.SELL_TARGET, price, recommendation.getSellTarget(), now);
        }
        return null;
    }

    private static PriceAlert alert(PriceAlert.Type type, BigDecimal price, BigDecimal target, Instant now) {
        return PriceAlert.builder()
                .timestamp(now)
                .type(type)
                .price(price)
                .target(target)
                .build();
    }
}
