package com.caradonti.finance_ledger.exception;

/**
 * Raised when a monetary value is negative, missing or otherwise unusable
 * for the operation that received it. Always thrown before any state is mutated.
 */
public class InvalidAmountException extends IllegalArgumentException {

    public InvalidAmountException(String message) {
        super(message);
    }
}
