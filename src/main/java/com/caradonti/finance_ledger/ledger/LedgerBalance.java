package com.caradonti.finance_ledger.ledger;

import com.caradonti.finance_ledger.money.MoneyPair;
import com.caradonti.finance_ledger.money.SignedMoneyPair;
import lombok.Value;

/**
 * Running totals of a sequence of movements.
 *
 * Invariant: {@code totalIncome - totalExpense == net}.
 */
@Value
public class LedgerBalance {

    public static final LedgerBalance EMPTY =
        new LedgerBalance(MoneyPair.ZERO, MoneyPair.ZERO, SignedMoneyPair.ZERO, 0);

    MoneyPair totalIncome;
    MoneyPair totalExpense;
    SignedMoneyPair net;
    int entryCount;
}
