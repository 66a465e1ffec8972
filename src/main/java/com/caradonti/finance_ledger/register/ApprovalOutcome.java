package com.caradonti.finance_ledger.register;

import lombok.Value;

/**
 * Result of an approve or reject call on an entry.
 *
 * {@code changed} is false when the call was a no-op (already approved,
 * already rejected, or the same role approving twice), which keeps client
 * retries idempotent.
 */
@Value
public class ApprovalOutcome {
    CashRegisterEntry entry;
    ApprovalStatus previousStatus;
    boolean changed;

    public boolean isNewlyApproved() {
        return previousStatus != ApprovalStatus.APPROVED
            && entry.getApprovalStatus() == ApprovalStatus.APPROVED;
    }

    public boolean isNewlyRejected() {
        return previousStatus != ApprovalStatus.REJECTED
            && entry.getApprovalStatus() == ApprovalStatus.REJECTED;
    }

    public static ApprovalOutcome unchanged(CashRegisterEntry entry) {
        return new ApprovalOutcome(entry, entry.getApprovalStatus(), false);
    }
}
