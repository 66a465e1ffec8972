package com.caradonti.finance_ledger.provider.dto;

import com.caradonti.finance_ledger.provider.Provider;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ProviderResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("category")
    String category;

    @JsonProperty("usage_count")
    long usageCount;

    @JsonProperty("total_amount_ars")
    BigDecimal totalAmountArs;

    @JsonProperty("total_amount_usd")
    BigDecimal totalAmountUsd;

    @JsonProperty("last_used_at")
    Instant lastUsedAt;

    public static ProviderResponse from(Provider provider) {
        return ProviderResponse.builder()
            .id(provider.getId())
            .name(provider.getName())
            .category(provider.getCategory())
            .usageCount(provider.getUsageCount())
            .totalAmountArs(provider.getTotalAmountArs())
            .totalAmountUsd(provider.getTotalAmountUsd())
            .lastUsedAt(provider.getLastUsedAt())
            .build();
    }
}
