package com.caradonti.finance_ledger.reconciliation;

import com.caradonti.finance_ledger.config.LedgerProperties;
import com.caradonti.finance_ledger.money.Currency;
import com.caradonti.finance_ledger.money.MoneyPair;
import com.caradonti.finance_ledger.money.SignedMoneyPair;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Compares a physical cash count with the expected total.
 *
 * {@code discrepancy = counted - expected} per currency, and
 * {@code pct = |discrepancy| / expected × 100} where expected is non-zero.
 * An alert is raised when any ratio is strictly above the alert threshold.
 * Thresholds are checked on the exact ratio; only the reported percentage is rounded.
 */
@Component
public class ReconciliationCalculator {

    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final int PCT_SCALE = 2;

    private final BigDecimal alertThresholdPct;
    private final BigDecimal matchThresholdPct;

    @Autowired
    public ReconciliationCalculator(LedgerProperties properties) {
        this(properties.getReconciliation().getAlertThresholdPct(),
             properties.getReconciliation().getMatchThresholdPct());
    }

    public ReconciliationCalculator(BigDecimal alertThresholdPct, BigDecimal matchThresholdPct) {
        this.alertThresholdPct = alertThresholdPct;
        this.matchThresholdPct = matchThresholdPct;
    }

    public ReconciliationResult reconcile(MoneyPair counted, MoneyPair expected) {
        if (counted == null) {
            throw new IllegalArgumentException("Counted amount is required");
        }
        MoneyPair exp = expected != null ? expected : MoneyPair.ZERO;

        SignedMoneyPair discrepancy = counted.toSigned().subtract(exp.toSigned());
        BigDecimal arsPct = percentage(discrepancy.getArs(), exp.getArs());
        BigDecimal usdPct = percentage(discrepancy.getUsd(), exp.getUsd());

        boolean alert = exceeds(discrepancy.getArs(), exp.getArs(), alertThresholdPct)
            || exceeds(discrepancy.getUsd(), exp.getUsd(), alertThresholdPct);
        CashCountStatus status = classify(counted, exp, discrepancy, alert);

        return new ReconciliationResult(counted, exp, discrepancy, arsPct, usdPct, status, alert);
    }

    private CashCountStatus classify(MoneyPair counted, MoneyPair expected,
                                     SignedMoneyPair discrepancy, boolean alert) {
        if (alert) {
            return CashCountStatus.MAJOR_DISCREPANCY;
        }
        if (isUnexpected(counted, expected, Currency.ARS) || isUnexpected(counted, expected, Currency.USD)) {
            return CashCountStatus.UNEXPECTED_CASH;
        }
        if (exceeds(discrepancy.getArs(), expected.getArs(), matchThresholdPct)
                || exceeds(discrepancy.getUsd(), expected.getUsd(), matchThresholdPct)) {
            return CashCountStatus.MINOR_DISCREPANCY;
        }
        return CashCountStatus.MATCH;
    }

    private static boolean isUnexpected(MoneyPair counted, MoneyPair expected, Currency currency) {
        return expected.get(currency).signum() == 0 && counted.get(currency).signum() > 0;
    }

    private static BigDecimal percentage(BigDecimal discrepancy, BigDecimal expected) {
        if (expected.signum() == 0) {
            return null;
        }
        return discrepancy.abs()
            .multiply(HUNDRED)
            .divide(expected, PCT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * {@code |discrepancy| × 100 > threshold × expected}, compared exactly so a
     * ratio of 5.004% still counts as above 5% although it is reported as 5.00.
     */
    private static boolean exceeds(BigDecimal discrepancy, BigDecimal expected, BigDecimal threshold) {
        if (expected.signum() == 0) {
            return false;
        }
        return discrepancy.abs().multiply(HUNDRED).compareTo(threshold.multiply(expected)) > 0;
    }
}
