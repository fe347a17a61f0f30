package com.pivotbot.backend.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Result of comparing ledger balances with the balances an exchange reports.
 * Drift is only reported, the ledger is never corrected from it.
 */
@Value
@Builder
public class ReconciliationReport {
    Instant checkedAt;
    BigDecimal tolerance;
    List<Discrepancy> discrepancies;

    public boolean isClean() {
        return discrepancies == null || discrepancies.isEmpty();
    }

    @Value
    public static class Discrepancy {
        String asset;
        BigDecimal ledgerAmount;
        BigDecimal exchangeAmount;

        public BigDecimal getDifference() {
            return exchangeAmount.subtract(ledgerAmount);
        }
    }
}
