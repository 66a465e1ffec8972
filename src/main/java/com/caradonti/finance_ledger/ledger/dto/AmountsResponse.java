package com.caradonti.finance_ledger.ledger.dto;

import com.caradonti.finance_ledger.money.MoneyPair;
import com.caradonti.finance_ledger.money.SignedMoneyPair;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

/**
 * ARS/USD amounts as rendered in responses.
 */
@Value
public class AmountsResponse {

    @JsonProperty("ars")
    BigDecimal ars;

    @JsonProperty("usd")
    BigDecimal usd;

    public static AmountsResponse from(MoneyPair pair) {
        return pair == null ? null : new AmountsResponse(pair.getArs(), pair.getUsd());
    }

    public static AmountsResponse from(SignedMoneyPair pair) {
        return pair == null ? null : new AmountsResponse(pair.getArs(), pair.getUsd());
    }
}
