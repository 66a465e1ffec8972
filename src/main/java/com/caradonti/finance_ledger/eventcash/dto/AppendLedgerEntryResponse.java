package com.caradonti.finance_ledger.eventcash.dto;

import com.caradonti.finance_ledger.eventcash.EventEntryAppended;
import com.caradonti.finance_ledger.ledger.dto.BalanceResponse;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * The appended entry with the balance, schedule and waterfall allocation it
 * produced. Only {@code entry} is set when the response replays an earlier request.
 */
@Value
public class AppendLedgerEntryResponse {

    @JsonProperty("entry")
    LedgerEntryResponse entry;

    @JsonProperty("balance")
    BalanceResponse balance;

    @JsonProperty("payment_status")
    PaymentStatusResponse paymentStatus;

    @JsonProperty("allocation")
    AllocationResponse allocation;

    public static AppendLedgerEntryResponse from(EventEntryAppended appended) {
        return new AppendLedgerEntryResponse(
            LedgerEntryResponse.from(appended.getEntry()),
            BalanceResponse.from(appended.getBalance()),
            PaymentStatusResponse.from(appended.getPaymentStatus()),
            AllocationResponse.from(appended.getAllocation()));
    }
}
