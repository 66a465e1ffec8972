package com.caradonti.finance_ledger.reconciliation;

public enum CashCountType {
    DAILY,
    WEEKLY,
    MONTHLY,
    SPECIAL,
    AUDIT
}
