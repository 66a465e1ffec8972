package com.caradonti.finance_ledger.eventcash.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.UUID;

@Value
public class AssignReferencesRequest {

    @JsonProperty("provider_id")
    UUID providerId;

    @JsonProperty("category_id")
    UUID categoryId;
}
