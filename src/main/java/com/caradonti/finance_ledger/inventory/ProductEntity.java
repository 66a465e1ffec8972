package com.caradonti.finance_ledger.inventory;

import com.caradonti.finance_ledger.money.MoneyPair;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "products")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProductEntity {

    @Id
    @Column(nullable = false, updatable = false, length = Product.MAX_SKU_LENGTH)
    private String sku;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(name = "current_stock", nullable = false)
    private int currentStock;

    @Column(name = "min_stock_threshold", nullable = false)
    private int minStockThreshold;

    @Column(name = "total_sold", nullable = false)
    private long totalSold;

    @Column(name = "total_revenue_ars", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalRevenueArs;

    @Column(name = "total_revenue_usd", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalRevenueUsd;

    @Column(name = "last_sold_at")
    private Instant lastSoldAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    private long version;

    static ProductEntity fromDomain(Product product) {
        ProductEntity entity = new ProductEntity();
        entity.sku = product.getSku();
        entity.name = product.getName();
        entity.currentStock = product.getCurrentStock();
        entity.minStockThreshold = product.getMinStockThreshold();
        entity.totalSold = product.getTotalSold();
        entity.totalRevenueArs = product.getTotalRevenueArs();
        entity.totalRevenueUsd = product.getTotalRevenueUsd();
        entity.lastSoldAt = product.getLastSoldAt();
        entity.createdAt = product.getCreatedAt();
        return entity;
    }

    public Product toDomain() {
        return new Product(sku, name, currentStock, minStockThreshold, totalSold,
            totalRevenueArs, totalRevenueUsd, lastSoldAt, createdAt);
    }

    /**
     * Takes {@code quantity} units off the shelf, clamping at zero.
     */
    void recordSale(int quantity, MoneyPair revenue) {
        this.currentStock = Math.max(0, currentStock - quantity);
        this.totalSold += quantity;
        this.totalRevenueArs = totalRevenueArs.add(revenue.getArs());
        this.totalRevenueUsd = totalRevenueUsd.add(revenue.getUsd());
        this.lastSoldAt = Instant.now();
    }

    void adjustStock(int newStock) {
        this.currentStock = newStock;
    }
}
