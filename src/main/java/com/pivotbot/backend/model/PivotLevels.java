package com.pivotbot.backend.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Classic floor-trader pivot levels for one closed period.
 */
public final class PivotLevels {
    private final BigDecimal pivot;
    private final BigDecimal resistance1;
    private final BigDecimal resistance2;
    private final BigDecimal support1;
    private final BigDecimal support2;

    public PivotLevels(BigDecimal pivot, BigDecimal resistance1, BigDecimal resistance2,
                       BigDecimal support1, BigDecimal support2) {
        this.pivot = Objects.requireNonNull(pivot);
        this.resistance1 = Objects.requireNonNull(resistance1);
        this.resistance2 = Objects.requireNonNull(resistance2);
        this.support1 = Objects.requireNonNull(support1);
        this.support2 = Objects.requireNonNull(support2);
    }

    public BigDecimal getPivot() {
        return pivot;
    }

    public BigDecimal getResistance1() {
        return resistance1;
    }

    public BigDecimal getResistance2() {
        return resistance2;
    }

    public BigDecimal getSupport1() {
        return support1;
    }

    public BigDecimal getSupport2() {
        return support2;
    }

    @Override
    public String toString() {
        return "PivotLevels{pp=" + pivot + ", r1=" + resistance1 + ", r2=" + resistance2
                + ", s1=" + support1 + ", s2=" + support2 + '}';
    }
}
