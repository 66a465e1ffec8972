package com.caradonti.finance_ledger.inventory;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A shop product. Stock never goes below zero.
 */
@Value
public class Product {

    public static final int DEFAULT_MIN_STOCK_THRESHOLD = 5;
    public static final int MAX_SKU_LENGTH = 50;

    String sku;
    String name;
    int currentStock;
    int minStockThreshold;
    long totalSold;
    BigDecimal totalRevenueArs;
    BigDecimal totalRevenueUsd;
    Instant lastSoldAt;
    Instant createdAt;

    public static Product create(String sku, String name, int currentStock, Integer minStockThreshold) {
        if (sku == null || sku.isBlank()) {
            throw new IllegalArgumentException("SKU is required");
        }
        if (sku.trim().length() > MAX_SKU_LENGTH) {
            throw new IllegalArgumentException("SKU must be at most " + MAX_SKU_LENGTH + " characters");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Product name is required");
        }
        if (currentStock < 0) {
            throw new IllegalArgumentException("Stock must not be negative");
        }
        int threshold = minStockThreshold != null ? minStockThreshold : DEFAULT_MIN_STOCK_THRESHOLD;
        if (threshold < 0) {
            throw new IllegalArgumentException("Minimum stock threshold must not be negative");
        }
        return new Product(sku.trim(), name.trim(), currentStock, threshold, 0L,
            BigDecimal.ZERO.setScale(2), BigDecimal.ZERO.setScale(2), null, Instant.now());
    }

    public boolean isLowStock() {
        return currentStock <= minStockThreshold;
    }
}
