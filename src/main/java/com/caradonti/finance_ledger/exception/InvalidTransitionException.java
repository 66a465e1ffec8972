package com.caradonti.finance_ledger.exception;

/**
 * Raised when an approval transition is requested from a terminal state that
 * does not allow it (approving a rejected entry, rejecting an approved one).
 */
public class InvalidTransitionException extends IllegalStateException {

    public InvalidTransitionException(String message) {
        super(message);
    }
}
