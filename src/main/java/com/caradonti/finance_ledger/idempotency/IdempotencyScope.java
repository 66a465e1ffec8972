package com.caradonti.finance_ledger.idempotency;

/**
 * Kind of append an idempotency key belongs to. The same key may be used once
 * per scope.
 */
public enum IdempotencyScope {
    EVENT_ENTRY("event-entry"),
    REGISTER_ENTRY("register-entry");

    private final String keyPrefix;

    IdempotencyScope(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }
}
