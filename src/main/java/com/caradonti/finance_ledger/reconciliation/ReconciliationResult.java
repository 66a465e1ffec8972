package com.caradonti.finance_ledger.reconciliation;

import com.caradonti.finance_ledger.money.Currency;
import com.caradonti.finance_ledger.money.MoneyPair;
import com.caradonti.finance_ledger.money.SignedMoneyPair;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Counted versus expected, per currency.
 *
 * A percentage is {@code null} when nothing was expected in that currency.
 */
@Value
public class ReconciliationResult {
    MoneyPair counted;
    MoneyPair expected;
    SignedMoneyPair discrepancy;
    BigDecimal arsDiscrepancyPct;
    BigDecimal usdDiscrepancyPct;
    CashCountStatus status;
    boolean alert;

    public BigDecimal getDiscrepancyPct(Currency currency) {
        return currency == Currency.ARS ? arsDiscrepancyPct : usdDiscrepancyPct;
    }
}
