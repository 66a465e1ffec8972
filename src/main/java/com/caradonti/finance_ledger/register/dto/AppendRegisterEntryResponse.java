package com.caradonti.finance_ledger.register.dto;

import com.caradonti.finance_ledger.ledger.dto.BalanceResponse;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * The created entry and the register balance right after it. {@code balance}
 * is null when the response replays an earlier request.
 */
@Value
public class AppendRegisterEntryResponse {

    @JsonProperty("entry")
    RegisterEntryResponse entry;

    @JsonProperty("balance")
    BalanceResponse balance;
}
