package com.caradonti.finance_ledger.register.dto;

import com.caradonti.finance_ledger.register.ApprovalOutcome;
import com.caradonti.finance_ledger.register.ApprovalStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Result of an approve or reject call. {@code changed} is false for a no-op retry.
 */
@Value
public class ApprovalResponse {

    @JsonProperty("entry")
    RegisterEntryResponse entry;

    @JsonProperty("previous_status")
    ApprovalStatus previousStatus;

    @JsonProperty("changed")
    boolean changed;

    public static ApprovalResponse from(ApprovalOutcome outcome) {
        return new ApprovalResponse(RegisterEntryResponse.from(outcome.getEntry()),
            outcome.getPreviousStatus(), outcome.isChanged());
    }
}
