package com.pivotbot.backend.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A price target that the market reached during a cycle.
 */
@Value
@Builder
public class PriceAlert {

    public enum Type {
        STOP_LOSS,
        TAKE_PROFIT,
        BUY_TARGET,
        SELL_TARGET
    }

    Instant timestamp;
    Type type;
    BigDecimal price;
    BigDecimal target;

    public String getMessage() {
        return type + " hit at " + price + " (target " + target + ")";
    }
}
