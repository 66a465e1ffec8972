package com.caradonti.finance_ledger.ledger;

/**
 * How the money of a ledger entry changed hands.
 */
public enum PaymentMethod {
    CASH,
    BANK_TRANSFER,
    CHECK,
    CARD,
    OTHER
}
