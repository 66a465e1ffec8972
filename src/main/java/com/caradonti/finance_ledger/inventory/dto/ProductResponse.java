package com.caradonti.finance_ledger.inventory.dto;

import com.caradonti.finance_ledger.inventory.Product;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class ProductResponse {

    @JsonProperty("sku")
    String sku;

    @JsonProperty("name")
    String name;

    @JsonProperty("current_stock")
    int currentStock;

    @JsonProperty("min_stock_threshold")
    int minStockThreshold;

    @JsonProperty("low_stock")
    boolean lowStock;

    @JsonProperty("total_sold")
    long totalSold;

    @JsonProperty("total_revenue_ars")
    BigDecimal totalRevenueArs;

    @JsonProperty("total_revenue_usd")
    BigDecimal totalRevenueUsd;

    @JsonProperty("last_sold_at")
    Instant lastSoldAt;

    public static ProductResponse from(Product product) {
        return ProductResponse.builder()
            .sku(product.getSku())
            .name(product.getName())
            .currentStock(product.getCurrentStock())
            .minStockThreshold(product.getMinStockThreshold())
            .lowStock(product.isLowStock())
            .totalSold(product.getTotalSold())
            .totalRevenueArs(product.getTotalRevenueArs())
            .totalRevenueUsd(product.getTotalRevenueUsd())
            .lastSoldAt(product.getLastSoldAt())
            .build();
    }
}
