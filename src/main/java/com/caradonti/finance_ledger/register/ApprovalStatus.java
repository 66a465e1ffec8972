package com.caradonti.finance_ledger.register;

/**
 * Approval lifecycle of a cash register entry.
 *
 * PENDING → APPROVED (terminal)
 * PENDING → REJECTED (terminal)
 *
 * Entries below the materiality threshold are created directly as APPROVED.
 */
public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
