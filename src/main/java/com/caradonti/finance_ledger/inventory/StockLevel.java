package com.caradonti.finance_ledger.inventory;

import lombok.Value;

/**
 * Stock of a product right after a sale was applied.
 */
@Value
public class StockLevel {
    String sku;
    String productName;
    int quantitySold;
    int remaining;
    int minThreshold;

    public boolean isLow() {
        return remaining <= minThreshold;
    }
}
