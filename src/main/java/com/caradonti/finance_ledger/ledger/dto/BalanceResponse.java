package com.caradonti.finance_ledger.ledger.dto;

import com.caradonti.finance_ledger.ledger.LedgerBalance;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BalanceResponse {

    @JsonProperty("total_income")
    AmountsResponse totalIncome;

    @JsonProperty("total_expense")
    AmountsResponse totalExpense;

    @JsonProperty("net")
    AmountsResponse net;

    @JsonProperty("entry_count")
    int entryCount;

    public static BalanceResponse from(LedgerBalance balance) {
        return BalanceResponse.builder()
            .totalIncome(AmountsResponse.from(balance.getTotalIncome()))
            .totalExpense(AmountsResponse.from(balance.getTotalExpense()))
            .net(AmountsResponse.from(balance.getNet()))
            .entryCount(balance.getEntryCount())
            .build();
    }
}
