package com.caradonti.finance_ledger.inventory.dto;

import com.caradonti.finance_ledger.inventory.Product;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class CreateProductRequest {

    @NotBlank(message = "SKU is required")
    @Size(max = Product.MAX_SKU_LENGTH, message = "SKU is too long")
    @JsonProperty("sku")
    String sku;

    @NotBlank(message = "Name is required")
    @Size(max = 200, message = "Name is too long")
    @JsonProperty("name")
    String name;

    @Min(value = 0, message = "Stock must not be negative")
    @JsonProperty("current_stock")
    int currentStock;

    @Min(value = 0, message = "Threshold must not be negative")
    @JsonProperty("min_stock_threshold")
    Integer minStockThreshold;
}
