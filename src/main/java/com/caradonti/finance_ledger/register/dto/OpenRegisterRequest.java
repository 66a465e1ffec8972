package com.caradonti.finance_ledger.register.dto;

import com.caradonti.finance_ledger.register.RegisterType;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class OpenRegisterRequest {

    @NotNull(message = "Register type is required")
    @JsonProperty("type")
    RegisterType type;

    @NotBlank(message = "Name is required")
    @Size(max = 200, message = "Name is too long")
    @JsonProperty("name")
    String name;
}
