package com.caradonti.finance_ledger.register;

/**
 * How many sign-offs an entry needs before it counts as approved.
 */
public enum ApprovalRequirement {
    /** Below materiality, approved at creation. */
    NONE(0),
    /** Any one approver role is enough. */
    SINGLE(1),
    /** Every approver role must sign off. */
    DUAL(ApproverRole.values().length);

    private final int requiredApprovals;

    ApprovalRequirement(int requiredApprovals) {
        this.requiredApprovals = requiredApprovals;
    }

    public int getRequiredApprovals() {
        return requiredApprovals;
    }
}
