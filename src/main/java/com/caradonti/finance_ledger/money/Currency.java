package com.caradonti.finance_ledger.money;

/**
 * Currencies tracked by the ledger.
 *
 * Amounts in each currency are kept as independent totals and are never
 * converted into one another.
 */
public enum Currency {
    ARS, // Argentine Peso
    USD  // US Dollar
}
