package com.caradonti.finance_ledger.register.dto;

import com.caradonti.finance_ledger.register.CashRegister;
import com.caradonti.finance_ledger.register.RegisterType;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class RegisterResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("type")
    RegisterType type;

    @JsonProperty("name")
    String name;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    public static RegisterResponse from(CashRegister register) {
        return RegisterResponse.builder()
            .id(register.getId())
            .type(register.getType())
            .name(register.getName())
            .createdBy(register.getCreatedBy())
            .createdAt(register.getCreatedAt())
            .build();
    }
}
