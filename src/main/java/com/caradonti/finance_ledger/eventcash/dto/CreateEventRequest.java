package com.caradonti.finance_ledger.eventcash.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
public class CreateEventRequest {

    @NotBlank(message = "Event name is required")
    @Size(max = 200, message = "Event name is too long")
    @JsonProperty("name")
    String name;

    @Size(max = 200, message = "Client name is too long")
    @JsonProperty("client_name")
    String clientName;

    @JsonProperty("event_date")
    LocalDate eventDate;

    @DecimalMin(value = "0.00", message = "Budget must not be negative")
    @JsonProperty("total_budget")
    BigDecimal totalBudget;
}
