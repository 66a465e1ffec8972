package com.caradonti.finance_ledger.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class StockAdjustmentRequest {

    @NotNull(message = "Stock is required")
    @Min(value = 0, message = "Stock must not be negative")
    @JsonProperty("current_stock")
    Integer currentStock;
}
