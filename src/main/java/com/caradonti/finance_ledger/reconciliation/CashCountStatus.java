package com.caradonti.finance_ledger.reconciliation;

/**
 * Classification of a count against what the ledger says should be there.
 */
public enum CashCountStatus {
    /** Every defined discrepancy is within the match tolerance. */
    MATCH,
    /** Off by more than the match tolerance but not past the alert threshold. */
    MINOR_DISCREPANCY,
    /** Past the alert threshold in at least one currency. */
    MAJOR_DISCREPANCY,
    /** Cash found in a currency the ledger expected to be empty. */
    UNEXPECTED_CASH
}
