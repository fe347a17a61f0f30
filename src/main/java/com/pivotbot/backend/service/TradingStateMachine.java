package com.pivotbot.backend.service;

import com.pivotbot.backend.config.TradingProperties;
import com.pivotbot.backend.model.AdvisorAction;
import com.pivotbot.backend.model.Decision;
import com.pivotbot.backend.model.DecisionContext;
import com.pivotbot.backend.model.DecisionReason;
import com.pivotbot.backend.model.DecisionState;
import com.pivotbot.backend.model.IndicatorSet;
import com.pivotbot.backend.model.Position;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Transition function of the IDLE / POSITION_OPEN machine. Has no side effects.
 *
 * <ul>
 *   <li>IDLE: the advisor's BUY/STRONG_BUY enters; an oversold RSI or an upward SMA cross enters
 *       unless the advisor says SELL/STRONG_SELL.</li>
 *   <li>POSITION_OPEN: stop-loss, then take-profit, then an advisor SELL/STRONG_SELL exits.</li>
 *   <li>No order at all while trading is not allowed.</li>
 * </ul>
 */
@Component
public class TradingStateMachine {

    private final BigDecimal rsiOversold;

    @Autowired
    public TradingStateMachine(TradingProperties properties) {
        this(properties.getRsiOversold());
    }

    public TradingStateMachine(BigDecimal rsiOversold) {
        this.rsiOversold = rsiOversold;
    }

    public Decision evaluate(DecisionState state, DecisionContext context) {
        if (!context.isTradingAllowed()) {
            return Decision.hold(DecisionReason.DAILY_LIMIT, state);
        }
        switch (state) {
            case IDLE:
                return evaluateIdle(context);
            case POSITION_OPEN:
                return evaluateOpen(context);
            default:
                throw new IllegalArgumentException("Unknown state " + state);
        }
    }

    private Decision evaluateIdle(DecisionContext context) {
        AdvisorAction advice = context.getRecommendation().getAction();
        if (advice.isBuy()) {
            return Decision.buy(DecisionReason.ADVISOR_BUY);
        }

        IndicatorSet indicators = context.getIndicators();
        DecisionReason indicatorReason = null;
        if (indicators.getRsi().compareTo(rsiOversold) < 0) {
            indicatorReason = DecisionReason.RSI_OVERSOLD;
        } else if (indicators.isSmaCrossedUp()) {
            indicatorReason = DecisionReason.SMA_CROSS_UP;
        }

        if (indicatorReason == null) {
            return Decision.hold(DecisionReason.NO_SIGNAL, DecisionState.IDLE);
        }
        if (advice.isSell()) {
            return Decision.hold(DecisionReason.ADVISOR_VETO, DecisionState.IDLE);
        }
        return Decision.buy(indicatorReason);
    }

    private Decision evaluateOpen(DecisionContext context) {
        Position position = context.getPosition();
        if (position == null) {
            throw new IllegalStateException("POSITION_OPEN without a position");
        }
        BigDecimal price = context.getCurrentPrice();
        // stop-loss wins when both levels are crossed
        if (price.compareTo(position.getStopLoss()) <= 0) {
            return Decision.sell(DecisionReason.STOP_LOSS);
        }
        if (price.compareTo(position.getTakeProfit()) >= 0) {
            return Decision.sell(DecisionReason.TAKE_PROFIT);
        }
        if (context.getRecommendation().getAction().isSell()) {
            return Decision.sell(DecisionReason.ADVISOR_SELL);
        }
        return Decision.hold(DecisionReason.NO_SIGNAL, DecisionState.POSITION_OPEN);
    }
}
