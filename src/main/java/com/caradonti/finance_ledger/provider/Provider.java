package com.caradonti.finance_ledger.provider;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A supplier referenced by expense entries, with running usage statistics.
 */
@Value
public class Provider {

    public static final int MAX_NAME_LENGTH = 200;

    UUID id;
    String name;
    String category;
    long usageCount;
    BigDecimal totalAmountArs;
    BigDecimal totalAmountUsd;
    Instant lastUsedAt;
    String createdBy;
    Instant createdAt;

    public static Provider create(String name, String category, String createdBy) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Provider name is required");
        }
        if (name.trim().length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("Provider name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        return new Provider(UUID.randomUUID(), name.trim(), category, 0L,
            BigDecimal.ZERO.setScale(2), BigDecimal.ZERO.setScale(2), null, createdBy, Instant.now());
    }
}
