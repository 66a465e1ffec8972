package com.caradonti.finance_ledger.ledger;

import com.caradonti.finance_ledger.money.MoneyPair;

/**
 * Anything that moves money in or out of a register or event.
 */
public interface Movement {

    MoneyPair getIncome();

    MoneyPair getExpense();
}
