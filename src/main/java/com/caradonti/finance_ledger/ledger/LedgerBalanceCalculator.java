package com.caradonti.finance_ledger.ledger;

import com.caradonti.finance_ledger.money.MoneyPair;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Folds movements into income, expense and net totals per currency.
 *
 * Pure and side-effect free: the balance is always recomputed from the full
 * current list of movements in insertion order, never applied as a delta.
 * Entry dates are informational and play no part in the fold.
 */
@Component
public class LedgerBalanceCalculator {

    public LedgerBalance calculate(List<? extends Movement> movements) {
        if (movements == null || movements.isEmpty()) {
            return LedgerBalance.EMPTY;
        }

        MoneyPair income = MoneyPair.ZERO;
        MoneyPair expense = MoneyPair.ZERO;
        for (Movement movement : movements) {
            income = income.add(movement.getIncome());
            expense = expense.add(movement.getExpense());
        }

        return new LedgerBalance(income, expense, MoneyPair.net(income, expense), movements.size());
    }
}
