package com.caradonti.finance_ledger.eventcash.dto;

import com.caradonti.finance_ledger.eventcash.InstallmentBucket;
import com.caradonti.finance_ledger.eventcash.OverflowPolicy;
import com.caradonti.finance_ledger.eventcash.WaterfallAllocation;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
public class AllocationResponse {

    @JsonProperty("payment_amount")
    BigDecimal paymentAmount;

    @JsonProperty("applied")
    Map<String, BigDecimal> applied;

    @JsonProperty("unallocated")
    BigDecimal unallocated;

    @JsonProperty("policy")
    OverflowPolicy policy;

    public static AllocationResponse from(WaterfallAllocation allocation) {
        if (allocation == null) {
            return null;
        }
        Map<String, BigDecimal> applied = new LinkedHashMap<>();
        for (InstallmentBucket bucket : InstallmentBucket.values()) {
            applied.put(bucket.name().toLowerCase(), allocation.appliedTo(bucket));
        }
        return new AllocationResponse(allocation.getPaymentAmount(), applied,
            allocation.getUnallocated(), allocation.getPolicy());
    }
}
