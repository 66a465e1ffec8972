package com.caradonti.finance_ledger.provider.dto;

import com.caradonti.finance_ledger.provider.Provider;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class CreateProviderRequest {

    @NotBlank(message = "Name is required")
    @Size(max = Provider.MAX_NAME_LENGTH, message = "Name is too long")
    @JsonProperty("name")
    String name;

    @Size(max = 100, message = "Category is too long")
    @JsonProperty("category")
    String category;
}
