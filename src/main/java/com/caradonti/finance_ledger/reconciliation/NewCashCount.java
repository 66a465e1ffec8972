package com.caradonti.finance_ledger.reconciliation;

import com.caradonti.finance_ledger.ledger.DateWindow;
import com.caradonti.finance_ledger.money.MoneyPair;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Input of a cash count. When {@code expected} is null it is derived from the
 * scope's ledger over {@code window}.
 */
@Value
public class NewCashCount {
    ScopeType scopeType;
    UUID scopeId;
    CashCountType countType;
    LocalDate countDate;
    MoneyPair counted;
    MoneyPair expected;
    DateWindow window;
    String notes;
}
