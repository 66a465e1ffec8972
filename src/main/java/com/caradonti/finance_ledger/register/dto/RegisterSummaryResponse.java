package com.caradonti.finance_ledger.register.dto;

import com.caradonti.finance_ledger.ledger.dto.AmountsResponse;
import com.caradonti.finance_ledger.register.RegisterSummary;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class RegisterSummaryResponse {

    @JsonProperty("register_id")
    UUID registerId;

    @JsonProperty("from")
    LocalDate from;

    @JsonProperty("to")
    LocalDate to;

    @JsonProperty("total_entries")
    long totalEntries;

    @JsonProperty("pending_approvals")
    long pendingEntries;

    @JsonProperty("approved_entries")
    long approvedEntries;

    @JsonProperty("rejected_entries")
    long rejectedEntries;

    @JsonProperty("total_income")
    AmountsResponse totalIncome;

    @JsonProperty("total_expense")
    AmountsResponse totalExpense;

    @JsonProperty("net")
    AmountsResponse net;

    public static RegisterSummaryResponse from(RegisterSummary summary) {
        return RegisterSummaryResponse.builder()
            .registerId(summary.getRegisterId())
            .from(summary.getFrom())
            .to(summary.getTo())
            .totalEntries(summary.getTotalEntries())
            .pendingEntries(summary.getPendingEntries())
            .approvedEntries(summary.getApprovedEntries())
            .rejectedEntries(summary.getRejectedEntries())
            .totalIncome(AmountsResponse.from(summary.getTotalIncome()))
            .totalExpense(AmountsResponse.from(summary.getTotalExpense()))
            .net(AmountsResponse.from(summary.getNet()))
            .build();
    }
}
