package com.caradonti.finance_ledger.register;

import lombok.Value;

import java.time.Instant;

/**
 * One sign-off recorded against an entry.
 */
@Value
public class Approval {
    ApproverRole role;
    String approvedBy;
    Instant approvedAt;
}
