package com.caradonti.finance_ledger.register;

import lombok.Value;

/**
 * Product sold by a shop entry. The stock decrement happens in the same
 * transaction as the entry.
 */
@Value
public class SaleLine {
    String sku;
    int quantity;

    public SaleLine(String sku, int quantity) {
        if (sku == null || sku.isBlank()) {
            throw new IllegalArgumentException("SKU is required for a sale");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("Sale quantity must be positive");
        }
        this.sku = sku.trim();
        this.quantity = quantity;
    }
}
