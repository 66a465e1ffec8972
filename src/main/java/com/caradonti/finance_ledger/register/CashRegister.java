package com.caradonti.finance_ledger.register;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A General, Shop or Deco cash book. Deco registers are one per decoration project.
 */
@Value
public class CashRegister {
    UUID id;
    RegisterType type;
    String name;
    String createdBy;
    Instant createdAt;

    public static CashRegister open(RegisterType type, String name, String createdBy) {
        if (type == null) {
            throw new IllegalArgumentException("Register type is required");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Register name is required");
        }
        return new CashRegister(UUID.randomUUID(), type, name.trim(), createdBy, Instant.now());
    }
}
