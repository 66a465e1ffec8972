package com.caradonti.finance_ledger.reconciliation;

/**
 * What a cash count reconciles against.
 */
public enum ScopeType {
    REGISTER,
    EVENT
}
