package com.caradonti.finance_ledger.register.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class ApproveEntryRequest {

    @NotBlank(message = "Approver role is required")
    @JsonProperty("role")
    String role;
}
