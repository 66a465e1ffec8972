package com.caradonti.finance_ledger.register;

import java.util.Locale;

/**
 * The two independent sign-off roles for General Cash disbursements.
 */
public enum ApproverRole {
    FEDE,
    SISTERS;

    /**
     * Parses a role as sent by clients ("fede", "Sisters", ...).
     */
    public static ApproverRole fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Approver role is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown approver role: " + value);
        }
    }
}
