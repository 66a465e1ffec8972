package com.caradonti.finance_ledger.register;

import com.caradonti.finance_ledger.money.MoneyPair;
import com.caradonti.finance_ledger.money.SignedMoneyPair;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Aggregate figures for one register over an optional date window.
 * Totals cover pending and approved entries; rejected entries are only counted.
 */
@Value
public class RegisterSummary {
    UUID registerId;
    LocalDate from;
    LocalDate to;
    long totalEntries;
    long pendingEntries;
    long approvedEntries;
    long rejectedEntries;
    MoneyPair totalIncome;
    MoneyPair totalExpense;

    public SignedMoneyPair getNet() {
        return MoneyPair.net(totalIncome, totalExpense);
    }
}
