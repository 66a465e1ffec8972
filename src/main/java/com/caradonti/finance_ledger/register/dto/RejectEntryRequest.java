package com.caradonti.finance_ledger.register.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class RejectEntryRequest {

    @NotBlank(message = "Rejection reason is required")
    @Size(max = 1000, message = "Reason is too long")
    @JsonProperty("reason")
    String reason;
}
